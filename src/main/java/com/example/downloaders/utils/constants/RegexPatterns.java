package com.example.downloaders.utils.constants;

import java.util.regex.Pattern;

public class RegexPatterns {
    public static final Pattern MAGNET_INFO_HASH = Pattern.compile(
            "xt=urn:btih:([a-fA-F0-9]{40}|[a-zA-Z2-7]{32})", Pattern.CASE_INSENSITIVE);
    public static final Pattern SID_COOKIE = Pattern.compile("SID=([^;]+)");
    public static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://");
    public static final Pattern FILE_PARAMETER = Pattern.compile("&file=[^&]*");
    public static final Pattern DUPLICATE = Pattern.compile("duplicate", Pattern.CASE_INSENSITIVE);
}
