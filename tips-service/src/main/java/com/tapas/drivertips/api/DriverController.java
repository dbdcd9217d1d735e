package com.tapas.drivertips.api;

import com.tapas.drivertips.dto.CreateDriverRequest;
import com.tapas.drivertips.service.DriverService;
import com.tapas.drivertips.service.TipQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/drivers")
public class DriverController {

    private final DriverService driverService;
    private final TipQueryService tipQueryService;

    public DriverController(DriverService driverService, TipQueryService tipQueryService) {
        this.driverService = driverService;
        this.tipQueryService = tipQueryService;
    }

    @Operation(summary = "Register a driver")
    @PostMapping
    public ResponseEntity<DriverResponse> createDriver(
            @RequestBody @Valid CreateDriverRequest request
    ) {
        DriverResponse response = DriverResponse.from(driverService.createDriver(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "List all drivers")
    @GetMapping
    public List<DriverResponse> getDrivers() {
        return driverService.getDrivers()
                .stream()
                .map(DriverResponse::from)
                .toList();
    }

    @Operation(
            summary = "Get a driver",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Driver found"),
                    @ApiResponse(responseCode = "404", description = "Unknown driver")
            }
    )
    @GetMapping("/{id}")
    public DriverResponse getDriver(
            @Parameter(description = "Driver identifier") @PathVariable String id
    ) {
        return DriverResponse.from(driverService.getDriverById(id));
    }

    @Operation(
            summary = "Tips of the current day and week",
            description = "Returns the driver's tip totals for today and for the current week (UTC). "
                    + "A bucket without any tip is returned as null.",
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Successful response",
                            content = @Content(
                                    mediaType = "application/json",
                                    schema = @Schema(implementation = DriverTipsResponse.class),
                                    examples = @ExampleObject(
                                            name = "driverTipsExample",
                                            value = "{\n  \"daily\": {\"driverId\": \"d1\", \"aggregationKey\": \"DAY#2024-01-15\", \"totalAmount\": 5.5, \"updatedAt\": \"2024-01-15T10:30:01Z\"},\n  \"weekly\": {\"driverId\": \"d1\", \"aggregationKey\": \"WEEK#2024-W03\", \"totalAmount\": 42.0, \"updatedAt\": \"2024-01-15T10:30:01Z\"}\n}"
                                    )
                            )
                    ),
                    @ApiResponse(responseCode = "404", description = "Unknown driver")
            }
    )
    @GetMapping("/{id}/tips")
    public DriverTipsResponse getDriverTips(
            @Parameter(description = "Driver identifier") @PathVariable String id
    ) {
        return DriverTipsResponse.from(tipQueryService.getDriverTips(id));
    }
}
