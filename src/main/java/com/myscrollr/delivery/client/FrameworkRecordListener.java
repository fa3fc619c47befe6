package com.myscrollr.delivery.client;

import com.myscrollr.delivery.model.dto.ChangeRecord;

import java.util.List;

/**
 * Consumes records of the tables the client itself depends on (preferences, channel setup).
 * These are never forwarded to surfaces.
 */
@FunctionalInterface
public interface FrameworkRecordListener {

    void onFrameworkRecords(String table, List<ChangeRecord> records);
}
