package com.ciro.markup.token;

public enum Severity {
    WARNING,
    ERROR
}
