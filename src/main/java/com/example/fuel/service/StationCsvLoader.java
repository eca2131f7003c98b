package com.example.fuel.service;

import com.example.fuel.exception.StationCatalogException;
import com.example.fuel.model.Station;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the retailer price CSV into a {@link StationCatalog}. Headers are matched case-insensitively;
 * rows missing a name, city or state are dropped.
 */
@Slf4j
@Component
public class StationCsvLoader {

    static final String NAME = "truckstop name";
    static final String ADDRESS = "address";
    static final String CITY = "city";
    static final String STATE = "state";
    static final String PRICE = "retail price";
    static final String LATITUDE = "latitude";
    static final String LONGITUDE = "longitude";

    private final CsvMapper csvMapper = new CsvMapper();

    public StationCatalog load(Resource resource) {
        if (!resource.exists()) {
            throw new StationCatalogException("Station CSV not found at " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            StationCatalog catalog = StationCatalog.of(read(in));
            log.info("Loaded {} stations in {} cities from {}", catalog.size(), catalog.locations().size(),
                    resource.getDescription());
            return catalog;
        } catch (IOException ex) {
            throw new StationCatalogException("Error loading station CSV " + resource.getDescription(), ex);
        }
    }

    List<Station> read(InputStream in) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Station> stations = new ArrayList<>();
        int skipped = 0;
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class).with(schema).readValues(in)) {
            boolean headerChecked = false;
            while (rows.hasNext()) {
                Map<String, String> row = normalizeKeys(rows.next());
                if (!headerChecked) {
                    if (!row.containsKey(CITY) || !row.containsKey(STATE)) {
                        throw new StationCatalogException("Missing required columns: 'City' or 'State'");
                    }
                    headerChecked = true;
                }
                Station station = toStation(row);
                if (station == null) {
                    skipped++;
                    continue;
                }
                stations.add(station);
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} station row(s) without name, city or state", skipped);
        }
        return stations;
    }

    private Station toStation(Map<String, String> row) {
        String name = trimToNull(row.get(NAME));
        String city = trimToNull(row.get(CITY));
        String state = trimToNull(row.get(STATE));
        if (name == null || city == null || state == null) {
            return null;
        }
        return Station.builder()
                .name(name)
                .address(trimToNull(row.get(ADDRESS)))
                .city(city.toLowerCase(Locale.ROOT))
                .state(state.toUpperCase(Locale.ROOT))
                .pricePerGallon(parseDouble(row.get(PRICE), name, PRICE))
                .latitude(parseDouble(row.get(LATITUDE), name, LATITUDE))
                .longitude(parseDouble(row.get(LONGITUDE), name, LONGITUDE))
                .build();
    }

    private static Map<String, String> normalizeKeys(Map<String, String> row) {
        Map<String, String> normalized = new HashMap<>();
        row.forEach((key, value) -> normalized.put(key.trim().toLowerCase(Locale.ROOT), value));
        return normalized;
    }

    private static Double parseDouble(String raw, String station, String column) {
        String value = trimToNull(raw);
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException ex) {
            log.warn("Ignoring unparseable {} '{}' for station {}", column, value, station);
            return null;
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
