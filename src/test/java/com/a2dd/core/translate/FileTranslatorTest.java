package com.a2dd.core.translate;

import com.a2dd.core.ConverterFixtures;
import com.a2dd.core.conversion.NotImplementedYetException;
import com.a2dd.core.model.Directive;
import com.a2dd.core.model.DirectiveKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileTranslatorTest {

    private final ConverterFixtures fx = new ConverterFixtures();
    private final FileTranslator translator = new FileTranslator();

    private List<Directive> translate(String yaml) {
        return translator.translate(fx.request(yaml)).directives();
    }

    private static Directive run(String payload) {
        return Directive.of(DirectiveKind.RUN, payload);
    }

    @Test
    @DisplayName("recursive directory is a WORKDIR followed by recursive chmod and chown")
    void recursiveDirectory() {
        assertEquals(List.of(
                Directive.of(DirectiveKind.WORKDIR, "--chmod 0755 --chown web:web /srv/www"),
                run("chmod -R 0755 /srv/www"),
                run("chown -R web:web /srv/www")
        ), translate("""
                file:
                  path: /srv/www
                  state: directory
                  recurse: yes
                  mode: "0755"
                  owner: web
                  group: web
                """));
    }

    @Test
    @DisplayName("templated recurse is not applied and stays in the residual")
    void templatedRecurse() {
        TranslationResult result = translator.translate(fx.request(
                "file: {path: /srv/www, state: directory, mode: \"0755\", recurse: \"{{ deep }}\"}"));

        assertEquals(List.of(Directive.of(DirectiveKind.WORKDIR, "--chmod 0755 /srv/www")), result.directives());
        assertEquals(Map.of("recurse", "{{ deep }}"), result.residual().get("file"));
    }

    @Test
    @DisplayName("directory without recurse is a single WORKDIR")
    void plainDirectory() {
        assertEquals(List.of(Directive.of(DirectiveKind.WORKDIR, "/opt/app")),
                translate("file: path=/opt/app state=directory"));
    }

    @Test
    @DisplayName("directory with SELinux type gets a SECONTEXT and recursive chcon")
    void directorySelinux() {
        assertEquals(List.of(
                Directive.of(DirectiveKind.WORKDIR, "/srv/www"),
                Directive.of(DirectiveKind.SECONTEXT, "--setype httpd_sys_content_t /srv/www"),
                run("chcon -R -t httpd_sys_content_t /srv/www")
        ), translate("file: {path: /srv/www, state: directory, setype: httpd_sys_content_t, recurse: true}"));
    }

    @Test
    @DisplayName("absent removes recursively")
    void absent() {
        assertEquals(List.of(run("rm -rf /tmp/cache")), translate("file: {dest: /tmp/cache, state: absent}"));
    }

    @Test
    @DisplayName("touch creates the file and applies attributes")
    void touch() {
        assertEquals(List.of(run("touch /var/log/app.log"), run("chmod 0644 /var/log/app.log")),
                translate("file: {name: /var/log/app.log, state: touch, mode: \"644\"}"));
    }

    @Test
    @DisplayName("default state only adjusts an existing file")
    void existingFile() {
        assertEquals(List.of(run("if [ -e /etc/app.conf ]; then chown root /etc/app.conf; fi")),
                translate("file: {path: /etc/app.conf, owner: root}"));
    }

    @Test
    @DisplayName("links are not implemented")
    void link() {
        TranslationRequest request = fx.request("file: {src: /a, dest: /b, state: link}");
        assertThrows(NotImplementedYetException.class, () -> translator.translate(request));
    }
}
