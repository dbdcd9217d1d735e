package com.tapas.drivertips.dto;

import jakarta.validation.constraints.NotBlank;

public record CreateDriverRequest(
        @NotBlank(message = "firstname is required") String firstname,
        @NotBlank(message = "lastname is required") String lastname,
        @NotBlank(message = "driverLicenseId is required") String driverLicenseId
) {}
