package com.a2dd.core.translate;

import com.a2dd.core.ConverterFixtures;
import com.a2dd.core.context.ScopeChain;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import com.a2dd.core.model.JobSequence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskTranslatorTest {

    private final ConverterFixtures fx = new ConverterFixtures();

    private JobSequence translate(String yaml) {
        return fx.taskTranslator.translate(fx.task(yaml), ScopeChain.root(null));
    }

    @Nested
    @DisplayName("Naming and comments")
    class Naming {

        @Test
        @DisplayName("every directive carries the task name")
        void nameApplied() {
            JobSequence jobs = translate("""
                    name: Prepare web root
                    file: {path: /srv, state: directory, recurse: yes, mode: "0755"}
                    """);

            assertEquals(2, jobs.size());
            jobs.directives().forEach(d -> assertEquals("Prepare web root", d.name()));
        }

        @Test
        @DisplayName("unnamed task gets the configured label")
        void unnamed() {
            assertEquals(fx.properties.getUnnamedTaskName(), translate("shell: uptime").get(0).name());
        }

        @Test
        @DisplayName("untranslated attributes become the TASK section")
        void taskContext() {
            Directive directive = translate("""
                    name: Restart
                    service: {name: httpd, state: restarted}
                    register: restart_result
                    """).get(0);

            assertEquals("## TASK-CONTEXT:\nregister: restart_result", directive.comment());
        }

        @Test
        @DisplayName("fully translated task has no comment")
        void noComment() {
            assertFalse(translate("dnf: name=git").get(0).hasComment());
        }
    }

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("unknown module becomes one ECHO carrying the whole task")
        void unsupportedModule() {
            JobSequence jobs = translate("""
                    name: Edit sshd config
                    lineinfile:
                      path: /etc/ssh/sshd_config
                      line: PermitRootLogin no
                    """);

            assertEquals(1, jobs.size());
            Directive echo = jobs.get(0);
            assertEquals(DirectiveKind.ECHO, echo.kind());
            assertEquals(UnsupportedModuleTranslator.message("lineinfile"), echo.payload());
            assertTrue(echo.comment().startsWith("## TASK-CONTEXT:"));
            assertTrue(echo.comment().contains("name: Edit sshd config"));
            assertTrue(echo.comment().contains("lineinfile:"));
            assertTrue(echo.comment().contains("path: /etc/ssh/sshd_config"));
            assertTrue(echo.comment().contains("line: PermitRootLogin no"));
        }
    }

    @Nested
    @DisplayName("Equivalent spellings")
    class Spellings {

        @Test
        @DisplayName("qualified and short module names convert identically")
        void namespaceEquivalence() {
            JobSequence qualified = translate("""
                    name: Place config
                    ansible.builtin.copy: {src: a.conf, dest: /etc/a.conf, mode: "0644"}
                    notify: reload
                    """);
            JobSequence plain = translate("""
                    name: Place config
                    copy: {src: a.conf, dest: /etc/a.conf, mode: "0644"}
                    notify: reload
                    """);

            assertEquals(plain, qualified);
        }

        @Test
        @DisplayName("action keyword converts like the module key")
        void actionKeyword() {
            assertEquals(translate("file: path=/tmp/x state=absent"),
                    translate("action: file path=/tmp/x state=absent"));
        }
    }

    @Nested
    @DisplayName("Registry")
    class Registry {

        @Test
        @DisplayName("two rules for one module are rejected")
        void duplicateRule() {
            assertThrows(IllegalStateException.class, () -> new ModuleTranslatorRegistry(
                    List.of(new CopyTranslator(), new CopyTranslator()), new UnsupportedModuleTranslator()));
        }

        @Test
        @DisplayName("unknown module resolves to the fallback")
        void fallback() {
            ModuleTranslatorRegistry registry = ModuleTranslatorRegistry.standard();
            assertFalse(registry.isSupported("lineinfile"));
            assertInstanceOf(UnsupportedModuleTranslator.class, registry.lookup("lineinfile"));
            assertInstanceOf(PackageTranslator.class, registry.lookup("yum"));
        }
    }

    @Test
    @DisplayName("set_fact emits one ARG per fact")
    void setFact() {
        JobSequence jobs = translate("""
                set_fact:
                  release: "9.2"
                  ports: [80, 443]
                  cacheable: true
                """);

        assertEquals(List.of(
                Directive.of(DirectiveKind.ARG, "release \"9.2\"").withName(fx.properties.getUnnamedTaskName()),
                Directive.of(DirectiveKind.ARG, "ports \"[80,443]\"").withName(fx.properties.getUnnamedTaskName())
        ), jobs.directives());
    }

    @Test
    @DisplayName("setup gathers facts and keeps filters in the comment")
    void setup() {
        Directive directive = translate("setup: {filter: ansible_eth*}").get(0);

        assertEquals(DirectiveKind.FACTER, directive.kind());
        assertEquals("", directive.payload());
        assertTrue(directive.comment().contains("filter: ansible_eth*"));
    }
}
