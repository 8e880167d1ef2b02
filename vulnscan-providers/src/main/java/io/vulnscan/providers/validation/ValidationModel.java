package io.vulnscan.providers.validation;

/**
 * Decides whether a code snippet actually exhibits a described vulnerability.
 */
public interface ValidationModel {

    Verdict validate(String candidateDescription, String codeSnippet);
}
