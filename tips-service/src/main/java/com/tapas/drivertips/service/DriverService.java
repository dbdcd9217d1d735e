package com.tapas.drivertips.service;

import com.tapas.drivertips.domain.Driver;
import com.tapas.drivertips.dto.CreateDriverRequest;
import com.tapas.drivertips.exception.DriverNotFoundException;
import com.tapas.drivertips.repository.DriverRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
public class DriverService {

    private final DriverRepository driverRepository;

    public DriverService(DriverRepository driverRepository) {
        this.driverRepository = driverRepository;
    }

    @Transactional
    public Driver createDriver(CreateDriverRequest request) {
        Driver driver = new Driver();
        driver.setId(UUID.randomUUID().toString());
        driver.setFirstname(request.firstname());
        driver.setLastname(request.lastname());
        driver.setDriverLicenseId(request.driverLicenseId());

        Driver saved = driverRepository.save(driver);
        log.info("Created driver {}", saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Driver getDriverById(String id) {
        return driverRepository.findById(id)
                .orElseThrow(() -> new DriverNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public List<Driver> getDrivers() {
        return driverRepository.findAll();
    }
}
