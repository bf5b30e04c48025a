package com.clinicqueue.appointment.api;

import static com.clinicqueue.appointment.AppointmentFixtures.queueEntry;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.clinicqueue.appointment.model.QueueAssignment;
import com.clinicqueue.appointment.model.QueueStatus;
import com.clinicqueue.appointment.service.QueueAssignerService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(QueueController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class QueueControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private QueueAssignerService queueAssignerService;

  @Test
  void enqueueReturnsPositionAndEstimate() throws Exception {
    when(queueAssignerService.enqueue(42L, 3L))
        .thenReturn(new QueueAssignment(queueEntry(7L, 42L, QueueStatus.WAITING, 12), 2, 15L));

    mockMvc
        .perform(
            post("/api/queue")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"appointment_id\":42,\"service_point_id\":3}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.counter").value(12))
        .andExpect(jsonPath("$.position").value(2))
        .andExpect(jsonPath("$.estimated_wait_minutes").value(15))
        .andExpect(jsonPath("$.status").value("WAITING"));
  }

  @Test
  void enqueueWithoutAppointmentReturns400() throws Exception {
    mockMvc
        .perform(post("/api/queue").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("appointment_id is required"));
  }

  @Test
  void callingServingEntryReturns409() throws Exception {
    when(queueAssignerService.call(7L))
        .thenThrow(new InvalidTransitionException("queue entry 7 cannot be called in status SERVING"));

    mockMvc
        .perform(post("/api/queue/7/call"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));
  }

  @Test
  void finishUnknownEntryReturns404() throws Exception {
    when(queueAssignerService.finish(8L)).thenThrow(new QueueEntryNotFoundException(8L));

    mockMvc.perform(post("/api/queue/8/finish")).andExpect(status().isNotFound());
  }
}
