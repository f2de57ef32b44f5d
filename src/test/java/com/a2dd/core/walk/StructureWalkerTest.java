package com.a2dd.core.walk;

import com.a2dd.core.ConverterFixtures;
import com.a2dd.core.context.ScopeChain;
import com.a2dd.core.conversion.UnsupportedConstructException;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import com.a2dd.core.model.JobSequence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructureWalkerTest {

    private final ConverterFixtures fx = new ConverterFixtures();

    @TempDir
    Path tempDir;

    private JobSequence walk(String yaml) {
        return fx.walker.walk(fx.list(yaml), ScopeChain.root(tempDir));
    }

    private void write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    @DisplayName("plain tasks are converted in order")
    void plainTasks() {
        JobSequence jobs = walk("""
                - name: one
                  shell: echo 1
                - name: two
                  dnf: name=git
                """);

        assertEquals(List.of(DirectiveKind.RUN, DirectiveKind.DNF),
                jobs.directives().stream().map(Directive::kind).toList());
    }

    @Test
    @DisplayName("non-mapping entry is rejected")
    void nonMappingEntry() {
        assertThrows(UnsupportedConstructException.class, () -> walk("- just a string"));
    }

    @Nested
    @DisplayName("Blocks")
    class Blocks {

        @Test
        @DisplayName("environment becomes ENV directives before the body")
        void blockEnvironment() {
            JobSequence jobs = walk("""
                    - environment:
                        HTTP_PROXY: http://proxy:3128
                      block:
                        - name: fetch
                          shell: curl -O http://example.com/a
                    """);

            assertEquals(new Directive(DirectiveKind.ENV, "HTTP_PROXY http://proxy:3128",
                    "Set block env value for HTTP_PROXY", null), jobs.get(0));
            assertEquals("export HTTP_PROXY=\"http://proxy:3128\";\ncurl -O http://example.com/a",
                    jobs.get(1).payload());
        }

        @Test
        @DisplayName("nested blocks each add a section")
        void nestedBlocks() {
            JobSequence jobs = walk("""
                    - when: outer_ok
                      block:
                        - tags: [inner]
                          block:
                            - name: leaf
                              shell: "true"
                              register: r
                    """);

            assertEquals(1, jobs.size());
            assertEquals("""
                    ## BLOCK-CONTEXT:
                    when: outer_ok
                    ## BLOCK-CONTEXT:
                    tags: ["inner"]
                    ## TASK-CONTEXT:
                    register: r""", jobs.get(0).comment());
        }

        @Test
        @DisplayName("block body must be a list")
        void blockBodyNotList() {
            assertThrows(UnsupportedConstructException.class, () -> walk("- block: {shell: ls}"));
        }
    }

    @Nested
    @DisplayName("Includes")
    class Includes {

        @Test
        @DisplayName("included file is spliced in place")
        void spliced() throws IOException {
            write("common/users.yml", """
                    - name: add user
                      shell: useradd app
                    """);

            JobSequence jobs = walk("""
                    - shell: echo before
                    - include_tasks: common/users.yml
                    - shell: echo after
                    """);

            assertEquals(List.of("echo before", "useradd app", "echo after"),
                    jobs.directives().stream().map(Directive::payload).toList());
        }

        @Test
        @DisplayName("include environment and attributes are recorded")
        void includeScope() throws IOException {
            write("inner.yml", "- shell: env\n");

            JobSequence jobs = walk("""
                    - import_tasks:
                        file: inner.yml
                      environment: {LANG: C}
                      when: ansible_os_family == 'RedHat'
                    """);

            assertEquals(2, jobs.size());
            assertEquals("Set include env value for LANG", jobs.get(0).name());
            assertEquals("LANG C", jobs.get(0).payload());
            assertEquals("env", jobs.get(1).payload());
            assertEquals("## INCLUDE-CONTEXT:\nwhen: ansible_os_family == 'RedHat'", jobs.get(1).comment());
        }

        @Test
        @DisplayName("legacy include ignores inline parameters")
        void legacyInclude() throws IOException {
            write("x.yml", "- shell: echo x\n");

            JobSequence jobs = walk("- include: x.yml flavour=plain\n");

            assertEquals("echo x", jobs.get(0).payload());
        }

        @Test
        @DisplayName("nested include resolves against the same directory")
        void nestedInclude() throws IOException {
            write("a.yml", "- include_tasks: b.yml\n");
            write("b.yml", "- shell: echo b\n");

            assertEquals("echo b", walk("- include_tasks: a.yml\n").get(0).payload());
        }

        @Test
        @DisplayName("self include is detected as a cycle")
        void cycle() throws IOException {
            write("loop.yml", "- include_tasks: loop.yml\n");

            var e = assertThrows(UnsupportedConstructException.class, () -> walk("- include_tasks: loop.yml\n"));
            assertTrue(e.getMessage().contains("cycle"));
        }

        @Test
        @DisplayName("including the same file twice in sequence is allowed")
        void repeatedInclude() throws IOException {
            write("x.yml", "- shell: echo x\n");

            assertEquals(2, walk("- include_tasks: x.yml\n- include_tasks: x.yml\n").size());
        }

        @Test
        @DisplayName("included file must hold a task list")
        void notATaskList() throws IOException {
            write("vars.yml", "a: 1\n");

            assertThrows(UnsupportedConstructException.class, () -> walk("- include_tasks: vars.yml\n"));
        }

        @Test
        @DisplayName("missing include is a conversion error")
        void missing() {
            assertThrows(UnsupportedConstructException.class, () -> walk("- include_tasks: nope.yml\n"));
        }
    }
}
