package io.b2mash.s3manager.storageconfig.dto;

public record ImportResult(int imported, int skipped) {}
