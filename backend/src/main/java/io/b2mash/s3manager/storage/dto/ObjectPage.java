package io.b2mash.s3manager.storage.dto;

import java.util.List;

public record ObjectPage(
    List<StoredObject> files,
    int total,
    int page,
    int pageSize,
    String configId,
    String configName) {}
