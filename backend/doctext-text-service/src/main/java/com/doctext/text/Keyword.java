package com.doctext.text;

public record Keyword(String token, int count) {}
