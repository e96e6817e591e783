package com.abba.rxreminder.infrastructure.web;

import com.abba.rxreminder.application.dto.ReminderJobView;
import com.abba.rxreminder.domain.exception.InvalidFormatException;
import com.abba.rxreminder.domain.exception.InvalidParameterException;
import com.abba.rxreminder.domain.exception.MissingParameterException;
import com.abba.rxreminder.domain.service.ReminderService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ReminderController.class)
class ReminderControllerTest {

    private static final ReminderJobView METFORMIN = new ReminderJobView(
            "+919876543210_Metformin_daily_0830",
            "+91***210",
            "Metformin",
            "daily",
            "08:30",
            OffsetDateTime.parse("2026-03-02T08:30+05:30"),
            OffsetDateTime.parse("2026-03-12T07:00+05:30"));

    @Autowired
    private MockMvc mockMvc;

    @SuppressWarnings("removal")
    @MockBean
    private ReminderService reminderService;

    @Test
    @DisplayName("POST /api/set-reminder schedules and echoes the job")
    void setReminderReturnsConfirmation() throws Exception {
        when(reminderService.scheduleReminder(any())).thenReturn(METFORMIN);

        mockMvc.perform(post("/api/set-reminder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "phone_number": "9876543210",
                                  "medication_name": "Metformin",
                                  "reminder_time": "08:30",
                                  "interval_type": "daily",
                                  "duration": "10"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Reminder for Metformin scheduled successfully!"))
                .andExpect(jsonPath("$.job_id").value("+919876543210_Metformin_daily_0830"))
                .andExpect(jsonPath("$.interval_type").value("daily"));

        verify(reminderService).scheduleReminder(argThat(request ->
                "9876543210".equals(request.getPhoneNumber())
                        && "Metformin".equals(request.getMedicationName())
                        && "10".equals(request.getDuration())));
    }

    @Test
    void numericDurationIsAcceptedAsText() throws Exception {
        when(reminderService.scheduleReminder(any())).thenReturn(METFORMIN);

        mockMvc.perform(post("/api/set-reminder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone_number\":\"9876543210\",\"medication_name\":\"Metformin\","
                                + "\"reminder_time\":\"08:30\",\"interval_type\":\"daily\",\"duration\":10}"))
                .andExpect(status().isOk());

        verify(reminderService).scheduleReminder(argThat(request -> "10".equals(request.getDuration())));
    }

    @Test
    void missingParametersAreBadRequest() throws Exception {
        when(reminderService.scheduleReminder(any()))
                .thenThrow(new MissingParameterException("Missing required parameters for reminder."));

        mockMvc.perform(post("/api/set-reminder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone_number\":\"9876543210\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing required parameters for reminder."))
                .andExpect(jsonPath("$.code").value("MISSING_PARAMETER"));
    }

    @Test
    void emptyBodyIsMissingParameters() throws Exception {
        mockMvc.perform(post("/api/set-reminder").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_PARAMETER"));

        verifyNoInteractions(reminderService);
    }

    @Test
    void malformedJsonIsAFormatError() throws Exception {
        mockMvc.perform(post("/api/set-reminder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone_number\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_FORMAT"));
    }

    @Test
    void formatAndParameterErrorsAreBadRequest() throws Exception {
        when(reminderService.scheduleReminder(any()))
                .thenThrow(new InvalidFormatException("Invalid time or duration format."))
                .thenThrow(new InvalidParameterException("Invalid interval_type. Must be 'daily' or 'weekly'."));
        String body = "{\"phone_number\":\"1\",\"medication_name\":\"A\",\"reminder_time\":\"8:xx\","
                + "\"interval_type\":\"monthly\",\"duration\":\"1\"}";

        mockMvc.perform(post("/api/set-reminder").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid time or duration format."))
                .andExpect(jsonPath("$.code").value("INVALID_FORMAT"));
        mockMvc.perform(post("/api/set-reminder").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PARAMETER"));
    }

    @Test
    void unexpectedFailureIsInternalError() throws Exception {
        when(reminderService.scheduleReminder(any())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/set-reminder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phone_number\":\"1\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"));
    }

    @Test
    @DisplayName("GET /api/reminders lists active jobs")
    void listsReminders() throws Exception {
        when(reminderService.listActiveReminders()).thenReturn(List.of(METFORMIN));

        mockMvc.perform(get("/api/reminders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].job_id").value("+919876543210_Metformin_daily_0830"))
                .andExpect(jsonPath("$[0].phone_number").value("+91***210"))
                .andExpect(jsonPath("$[0].reminder_time").value("08:30"));
    }
}
