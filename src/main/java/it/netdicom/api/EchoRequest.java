package it.netdicom.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record EchoRequest(
    @NotBlank String host,
    @Min(1) @Max(65535) int port,
    @NotBlank @Size(max = 16) String calledAeTitle
) {
}
