package com.climapipeline.service.store;

import com.climapipeline.core.model.WeatherDataset;
import com.climapipeline.core.model.WriteMode;

import java.nio.file.Path;

public interface WeatherStore {
    /**
     * Persists {@code dataset} at {@code path} and returns the number of rows in the resulting file.
     * In {@link WriteMode#APPEND} existing rows are merged with the new ones, newer rows winning on
     * equal timestamps.
     *
     * @throws com.climapipeline.core.error.StorageException    when the file cannot be written or
     *                                                          changed underneath the merge
     * @throws com.climapipeline.core.error.CorruptFileException when appending to an unreadable table
     */
    int save(WeatherDataset dataset, Path path, WriteMode mode);

    /**
     * Reads the table at {@code path}; a missing file is an empty dataset.
     */
    WeatherDataset load(Path path);
}
