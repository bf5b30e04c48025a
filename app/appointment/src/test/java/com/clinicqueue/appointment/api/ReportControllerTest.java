package com.clinicqueue.appointment.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.clinicqueue.appointment.analytics.AppointmentAnalyticsService;
import com.clinicqueue.appointment.analytics.ReportFilterFactory;
import com.clinicqueue.appointment.analytics.WaitTimeAnalyticsService;
import com.clinicqueue.appointment.analytics.model.AppointmentSummary;
import com.clinicqueue.appointment.analytics.model.TimeMetrics;
import com.clinicqueue.appointment.analytics.model.WaitTimeByBranch;
import com.clinicqueue.appointment.model.DateRange;
import com.clinicqueue.appointment.model.ReportFilters;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ReportController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class ReportControllerTest {

  private static final LocalDate START = LocalDate.of(2026, 3, 1);
  private static final LocalDate END = LocalDate.of(2026, 3, 7);
  private static final ReportFilters FILTERS =
      new ReportFilters(DateRange.ofDays(START, END, ZoneOffset.UTC), 10L, null, null);

  @Autowired private MockMvc mockMvc;

  @MockitoBean private WaitTimeAnalyticsService waitTimeAnalytics;
  @MockitoBean private AppointmentAnalyticsService appointmentAnalytics;
  @MockitoBean private ReportFilterFactory filterFactory;

  @Test
  void waitTimesByBranchReturnsMetrics() throws Exception {
    when(filterFactory.create(START, END, 10L, null, null)).thenReturn(FILTERS);
    when(waitTimeAnalytics.getWaitTimesByBranch(FILTERS))
        .thenReturn(
            List.of(
                new WaitTimeByBranch(
                    10L, "Centro", new TimeMetrics(5, 5, 0, 10, 3), TimeMetrics.ZERO, 3)));

    mockMvc
        .perform(
            get("/api/reports/wait-times/branches")
                .param("startDate", "2026-03-01")
                .param("endDate", "2026-03-07")
                .param("branchId", "10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].branchName").value("Centro"))
        .andExpect(jsonPath("$[0].waitTime.median").value(5))
        .andExpect(jsonPath("$[0].totalProcessed").value(3));
  }

  @Test
  void appointmentSummaryReturnsRates() throws Exception {
    when(filterFactory.create(START, END, 10L, null, null)).thenReturn(FILTERS);
    when(appointmentAnalytics.getAppointmentsSummary(FILTERS))
        .thenReturn(new AppointmentSummary(8, 2, 1, 4, 0, 1, 3, 62.5d, 50d, 12.5d));

    mockMvc
        .perform(
            get("/api/reports/appointments/summary")
                .param("startDate", "2026-03-01")
                .param("endDate", "2026-03-07")
                .param("branchId", "10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.attendanceRate").value(62.5d));
  }

  @Test
  void malformedDateReturns400() throws Exception {
    mockMvc
        .perform(
            get("/api/reports/appointments/trends")
                .param("startDate", "03/01/2026")
                .param("endDate", "2026-03-07"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("startDate is invalid"));
  }

  @Test
  void reversedDatesReturn400() throws Exception {
    when(filterFactory.create(END, START, null, null, null))
        .thenThrow(new IllegalArgumentException("startDate must not be after endDate"));

    mockMvc
        .perform(
            get("/api/reports/appointments/trends")
                .param("startDate", "2026-03-07")
                .param("endDate", "2026-03-01"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("startDate must not be after endDate"));
  }
}
