package com.abba.rxreminder.infrastructure.web;

import com.abba.rxreminder.application.dto.ReminderJobView;
import com.abba.rxreminder.application.dto.SetReminderRequest;
import com.abba.rxreminder.application.dto.SetReminderResponse;
import com.abba.rxreminder.domain.exception.MissingParameterException;
import com.abba.rxreminder.domain.service.ReminderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ReminderController {

    private final ReminderService reminderService;

    @PostMapping(value = "/set-reminder", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SetReminderResponse> setReminder(@RequestBody(required = false) SetReminderRequest request) {
        if (request == null) {
            throw new MissingParameterException("Missing required parameters for reminder.");
        }
        ReminderJobView scheduled = reminderService.scheduleReminder(request);
        return ResponseEntity.ok(SetReminderResponse.scheduled(scheduled));
    }

    @GetMapping("/reminders")
    public List<ReminderJobView> listReminders() {
        return reminderService.listActiveReminders();
    }
}
