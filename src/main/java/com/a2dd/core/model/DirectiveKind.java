package com.a2dd.core.model;

/**
 * Directive vocabulary understood by the DirectorD job format.
 * The enum constant name is the key written to the output document.
 */
public enum DirectiveKind {
    RUN,
    COPY,
    DNF,
    SERVICE,
    SECONTEXT,
    WORKDIR,
    ENV,
    ARG,
    FACTER,
    ECHO
}
