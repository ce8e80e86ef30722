package com.vidnyan.ust.domain.error;

import lombok.Getter;

/**
 * No registered parser resolves for the requested language or file extension.
 */
@Getter
public class UnsupportedLanguageException extends RuntimeException {

    private final String language;
    private final String filePath;

    public UnsupportedLanguageException(String language, String filePath) {
        super("No parser found for language '" + language + "' or file '" + filePath + "'");
        this.language = language;
        this.filePath = filePath;
    }
}
