package com.tapas.drivertips.api;

import com.tapas.drivertips.domain.Driver;

public record DriverResponse(
        String id,
        String firstname,
        String lastname,
        String driverLicenseId
) {
    public static DriverResponse from(Driver driver) {
        return new DriverResponse(
                driver.getId(),
                driver.getFirstname(),
                driver.getLastname(),
                driver.getDriverLicenseId()
        );
    }
}
