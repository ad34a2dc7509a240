package com.ethnicthv.domain.processor.model;

public record GeneratedSource(String qualifiedName, String content) {
}
