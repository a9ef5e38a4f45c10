package com.confer.mortgageServer.util;

/**
 * Utility class for masking document URLs in logs.
 * Signed storage URLs carry credentials in the query string, so only scheme, host and path are kept.
 */
public class UrlMasker {

    private UrlMasker() {}

    /**
     * Masks the query and fragment of a URL for logging.
     *
     * @param url The URL to mask
     * @return URL with query and fragment replaced (e.g., "https://host/doc.pdf?****")
     */
    public static String mask(String url) {
        if (url == null) {
            return "****";
        }
        int cut = indexOfAny(url, '?', '#');
        return cut < 0 ? url : url.substring(0, cut) + "?****";
    }

    private static int indexOfAny(String text, char first, char second) {
        int a = text.indexOf(first);
        int b = text.indexOf(second);
        if (a < 0) {
            return b;
        }
        return b < 0 ? a : Math.min(a, b);
    }
}
