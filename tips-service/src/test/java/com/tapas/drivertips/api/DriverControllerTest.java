package com.tapas.drivertips.api;

import com.tapas.drivertips.domain.Driver;
import com.tapas.drivertips.domain.TipAggregate;
import com.tapas.drivertips.dto.CreateDriverRequest;
import com.tapas.drivertips.dto.DriverTips;
import com.tapas.drivertips.exception.DriverNotFoundException;
import com.tapas.drivertips.exception.StoreRejectedException;
import com.tapas.drivertips.service.DriverService;
import com.tapas.drivertips.service.TipQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DriverControllerTest {

    @Mock
    private DriverService driverService;

    @Mock
    private TipQueryService tipQueryService;

    @InjectMocks
    private DriverController driverController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(driverController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private Driver buildDriver(String id) {
        Driver driver = new Driver();
        driver.setId(id);
        driver.setFirstname("John");
        driver.setLastname("Doe");
        driver.setDriverLicenseId("DL123456");
        return driver;
    }

    @Test
    void createDriver_shouldReturn201WithDriver() throws Exception {
        when(driverService.createDriver(new CreateDriverRequest("John", "Doe", "DL123456")))
                .thenReturn(buildDriver("driver-123"));

        mockMvc.perform(post("/drivers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"firstname\":\"John\",\"lastname\":\"Doe\",\"driverLicenseId\":\"DL123456\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("driver-123"))
                .andExpect(jsonPath("$.firstname").value("John"))
                .andExpect(jsonPath("$.driverLicenseId").value("DL123456"));
    }

    @Test
    void createDriver_shouldReturn400_whenFieldsMissing() throws Exception {
        mockMvc.perform(post("/drivers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"firstname\":\"\",\"lastname\":\"Doe\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.errors", containsInAnyOrder(
                        "driverLicenseId: driverLicenseId is required",
                        "firstname: firstname is required")));

        verifyNoInteractions(driverService);
    }

    @Test
    void createDriver_shouldReturn400_whenBodyIsNotJson() throws Exception {
        mockMvc.perform(post("/drivers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid JSON in request body"));
    }

    @Test
    void getDrivers_shouldReturnAllDrivers() throws Exception {
        when(driverService.getDrivers()).thenReturn(List.of(buildDriver("driver-1"), buildDriver("driver-2")));

        mockMvc.perform(get("/drivers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("driver-1"))
                .andExpect(jsonPath("$[1].id").value("driver-2"));
    }

    @Test
    void getDriver_shouldReturn404_whenUnknown() throws Exception {
        when(driverService.getDriverById("missing")).thenThrow(new DriverNotFoundException("missing"));

        mockMvc.perform(get("/drivers/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Driver with id 'missing' not found"))
                .andExpect(jsonPath("$.errors").doesNotExist());
    }

    @Test
    void getDriverTips_shouldRenderAggregates() throws Exception {
        Instant updatedAt = Instant.parse("2024-01-15T10:30:01Z");
        when(tipQueryService.getDriverTips("d1")).thenReturn(new DriverTips(
                new TipAggregate("d1", "DAY#2024-01-15", new BigDecimal("5.50"), updatedAt, updatedAt),
                new TipAggregate("d1", "WEEK#2024-W03", new BigDecimal("42.00"), updatedAt, updatedAt)));

        mockMvc.perform(get("/drivers/d1/tips"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.daily.driverId").value("d1"))
                .andExpect(jsonPath("$.daily.aggregationKey").value("DAY#2024-01-15"))
                .andExpect(jsonPath("$.daily.totalAmount").value(5.5))
                .andExpect(jsonPath("$.daily.updatedAt").value("2024-01-15T10:30:01Z"))
                .andExpect(jsonPath("$.daily.createdAt").doesNotExist())
                .andExpect(jsonPath("$.weekly.aggregationKey").value("WEEK#2024-W03"))
                .andExpect(jsonPath("$.weekly.totalAmount").value(42.0));
    }

    @Test
    void getDriverTips_shouldRenderNulls_whenNoTips() throws Exception {
        when(tipQueryService.getDriverTips("d1")).thenReturn(new DriverTips(null, null));

        mockMvc.perform(get("/drivers/d1/tips"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.daily").value(nullValue()))
                .andExpect(jsonPath("$.weekly").value(nullValue()));
    }

    @Test
    void getDriverTips_shouldReturn404_whenDriverUnknown() throws Exception {
        when(tipQueryService.getDriverTips("missing")).thenThrow(new DriverNotFoundException("missing"));

        mockMvc.perform(get("/drivers/missing/tips"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getDriverTips_shouldReturn503_whenStoreRejects() throws Exception {
        when(tipQueryService.getDriverTips(anyString())).thenThrow(new StoreRejectedException("throttled", null));

        mockMvc.perform(get("/drivers/d1/tips"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void getDriverTips_shouldReturn503_whenExecutorSaturated() throws Exception {
        when(tipQueryService.getDriverTips("d1")).thenThrow(new RejectedExecutionException("queue full"));

        mockMvc.perform(get("/drivers/d1/tips"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Service busy, retry later"));
    }
}
