package io.b2mash.s3manager.provisioning;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ProvisionRequest(@NotBlank @Size(max = 100) String username) {}
