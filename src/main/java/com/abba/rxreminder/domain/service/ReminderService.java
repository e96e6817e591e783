package com.abba.rxreminder.domain.service;

import com.abba.rxreminder.application.dto.ReminderJobView;
import com.abba.rxreminder.application.dto.SetReminderRequest;

import java.util.List;

public interface ReminderService {

    ReminderJobView scheduleReminder(SetReminderRequest request);

    List<ReminderJobView> listActiveReminders();
}
