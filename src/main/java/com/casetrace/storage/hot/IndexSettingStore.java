package com.casetrace.storage.hot;

import java.util.Optional;

/**
 * Reads and writes a single named marker on an index.
 */
public interface IndexSettingStore {

    boolean indexExists(String index);

    Optional<String> getSetting(String index, String key);

    void putSetting(String index, String key, String value);
}
