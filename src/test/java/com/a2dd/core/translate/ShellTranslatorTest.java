package com.a2dd.core.translate;

import com.a2dd.core.ConverterFixtures;
import com.a2dd.core.context.ScopeChain;
import com.a2dd.core.context.ScopeFrame;
import com.a2dd.core.conversion.UnsupportedConstructException;
import com.a2dd.core.model.DirectiveKind;
import com.a2dd.core.model.ScopeContext;
import com.a2dd.core.model.ScopeKind;
import com.a2dd.core.model.TaskNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ShellTranslatorTest {

    private final ConverterFixtures fx = new ConverterFixtures();
    private final ShellTranslator translator = new ShellTranslator();

    @Test
    @DisplayName("free-form command with args.chdir starts with cd")
    void chdirFromArgs() {
        TranslationResult result = translator.translate(fx.request("""
                name: list
                shell: ls -l
                args:
                  chdir: /tmp
                """));

        assertEquals(1, result.directives().size());
        assertEquals(DirectiveKind.RUN, result.directives().get(0).kind());
        assertEquals("cd /tmp;\nls -l", result.directives().get(0).payload());
        assertTrue(result.residual().isEmpty());
    }

    @Test
    @DisplayName("mapping form reads cmd and chdir from the module")
    void mappingForm() {
        TranslationResult result = translator.translate(fx.request("""
                command:
                  cmd: make install
                  chdir: /opt/src
                """));

        assertEquals("cd /opt/src;\nmake install", result.directives().get(0).payload());
    }

    @Test
    @DisplayName("task environment is exported after scope environments")
    void environmentOrder() {
        TaskNode play = TaskNode.of(Map.of("environment", Map.of("A", "1")));
        TaskNode block = TaskNode.of(Map.of("environment", Map.of("B", "2")));
        ScopeChain scope = ScopeChain.root(null)
                .descend(new ScopeFrame(ScopeKind.PLAY, play, ScopeContext.empty(ScopeKind.PLAY)))
                .descend(new ScopeFrame(ScopeKind.BLOCK, block, ScopeContext.empty(ScopeKind.BLOCK)));
        TaskNode task = fx.task("""
                shell: echo $A $B
                environment:
                  A: "3"
                """);

        TranslationResult result = translator.translate(
                TranslationRequest.of(fx.resolver.resolve(task), task, scope));

        assertEquals("""
                export A="1";
                export B="2";
                export A="3";
                echo $A $B""", result.directives().get(0).payload());
        assertFalse(result.residual().containsKey("environment"));
    }

    @Test
    @DisplayName("templated environment stays in the residual")
    void templatedEnvironment() {
        TranslationResult result = translator.translate(fx.request("""
                shell: env
                environment: "{{ proxy_env }}"
                """));

        assertEquals("env", result.directives().get(0).payload());
        assertEquals("{{ proxy_env }}", result.residual().get("environment"));
    }

    @Test
    @DisplayName("unconsumed args are reported back")
    void leftoverArgs() {
        TranslationResult result = translator.translate(fx.request("""
                shell: ./configure
                args:
                  chdir: /src
                  creates: /src/Makefile
                """));

        assertEquals(Map.of("creates", "/src/Makefile"), result.residual().get("args"));
    }

    @Test
    @DisplayName("argv form has no command string")
    void argvRejected() {
        TranslationRequest request = fx.request("""
                command:
                  argv: [ls, -l]
                """);
        assertThrows(UnsupportedConstructException.class, () -> translator.translate(request));
    }
}
