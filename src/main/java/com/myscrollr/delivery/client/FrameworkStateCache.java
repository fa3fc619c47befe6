package com.myscrollr.delivery.client;

import com.myscrollr.delivery.model.dto.ChangeAction;
import com.myscrollr.delivery.model.dto.ChangeRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Latest user preferences and channel setup as seen on the stream.
 */
@Slf4j
public class FrameworkStateCache implements FrameworkRecordListener {

    public static final String PREFERENCES_TABLE = "user_preferences";
    public static final String CHANNELS_TABLE = "user_channels";

    private Map<String, Object> preferences = Map.of();
    private final Map<String, Map<String, Object>> channels = new LinkedHashMap<>();

    @Override
    public void onFrameworkRecords(String table, List<ChangeRecord> records) {
        for (ChangeRecord record : records) {
            if (record.getRecord() == null || record.getAction() == null) {
                continue;
            }
            switch (table) {
                case PREFERENCES_TABLE -> applyPreferences(record);
                case CHANNELS_TABLE -> applyChannel(record);
                default -> log.debug("[CLIENT] No framework handling for table '{}'", table);
            }
        }
    }

    public Map<String, Object> preferences() {
        return preferences;
    }

    public Map<String, Map<String, Object>> channels() {
        return Map.copyOf(channels);
    }

    private void applyPreferences(ChangeRecord record) {
        preferences = record.getAction() == ChangeAction.DELETE ? Map.of() : new LinkedHashMap<>(record.getRecord());
    }

    private void applyChannel(ChangeRecord record) {
        String channelType = record.stringField("channel_type");
        if (channelType == null) {
            log.warn("[CLIENT] Channel record without channel_type skipped");
            return;
        }
        if (record.getAction() == ChangeAction.DELETE) {
            channels.remove(channelType);
        } else {
            channels.put(channelType, new LinkedHashMap<>(record.getRecord()));
        }
    }
}
