package com.example.courtalert.repository;

import com.example.courtalert.model.NotificationRecord;
import java.time.Instant;
import java.util.List;

public interface NotificationRecordRepository {

  void append(NotificationRecord record);

  /** Records of the subscription sent at or after {@code since}, oldest first. */
  List<NotificationRecord> queryRecords(String subscriptionId, Instant since);
}
