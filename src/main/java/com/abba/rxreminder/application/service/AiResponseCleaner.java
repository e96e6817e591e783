package com.abba.rxreminder.application.service;

import java.util.regex.Pattern;

/**
 * Strips the packaging language models put around a JSON answer: a fenced code block and any
 * prose before the first opening brace. The result is not validated here.
 */
public final class AiResponseCleaner {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private AiResponseCleaner() {
    }

    public static String clean(String rawText) {
        if (rawText == null) {
            return "";
        }
        String cleaned = FENCED_BLOCK.matcher(rawText).replaceAll("$1");
        int jsonStart = cleaned.indexOf('{');
        if (jsonStart != -1) {
            cleaned = cleaned.substring(jsonStart);
        }
        return cleaned.trim();
    }
}
