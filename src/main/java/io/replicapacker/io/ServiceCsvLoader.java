package io.replicapacker.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.replicapacker.models.ResourceVector;
import io.replicapacker.models.ServiceDemand;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.replicapacker.config.Constants.*;

/**
 * Reads the service inventory CSV.
 * 
 * Expected header:
 * Servicios,Cantidad,USO CPU (%),E/S Red (Mbs),E/S disco (MB/s),Uso Disco (GB),Memoria (GB)
 * 
 * CPU is given as a percentage of one core and converted to cores.
 */
@Slf4j
public class ServiceCsvLoader {
    
    private static final List<String> REQUIRED_COLUMNS = List.of(
        CSV_COLUMN_SERVICE, CSV_COLUMN_QUANTITY, CSV_COLUMN_CPU_PERCENT, CSV_COLUMN_NETWORK,
        CSV_COLUMN_DISK_IO, CSV_COLUMN_STORAGE, CSV_COLUMN_MEMORY);
    
    private final CsvMapper csvMapper = new CsvMapper();
    
    public List<ServiceDemand> load(Path path) throws IOException {
        log.info("Loading services from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }
    
    /**
     * @throws IllegalArgumentException if a required column is missing or a value is malformed
     */
    public List<ServiceDemand> load(Reader reader) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<ServiceDemand> services = new ArrayList<>();
        
        try (MappingIterator<Map<String, String>> rows = csvMapper
                .readerFor(Map.class)
                .with(schema)
                .readValues(reader)) {
            int rowNumber = 1; // header is row 1
            while (rows.hasNext()) {
                rowNumber++;
                Map<String, String> row = trimKeys(rows.next());
                services.add(parseRow(row, rowNumber));
            }
        }
        
        log.info("Loaded {} services", services.size());
        return services;
    }
    
    private ServiceDemand parseRow(Map<String, String> row, int rowNumber) {
        for (String column : REQUIRED_COLUMNS) {
            if (!row.containsKey(column)) {
                throw new IllegalArgumentException("Row " + rowNumber + ": missing column '" + column + "'");
            }
        }
        
        String serviceName = row.get(CSV_COLUMN_SERVICE).trim();
        if (serviceName.isEmpty()) {
            throw new IllegalArgumentException("Row " + rowNumber + ": service name is empty");
        }
        
        double quantity = number(row, CSV_COLUMN_QUANTITY, rowNumber);
        if (quantity < 0 || quantity > Integer.MAX_VALUE || quantity != Math.floor(quantity)) {
            throw new IllegalArgumentException("Row " + rowNumber + ": quantity must be a non-negative integer, got " 
                + row.get(CSV_COLUMN_QUANTITY));
        }
        
        ResourceVector demand = ResourceVector.of(
            number(row, CSV_COLUMN_CPU_PERCENT, rowNumber) / 100.0,
            number(row, CSV_COLUMN_MEMORY, rowNumber),
            number(row, CSV_COLUMN_NETWORK, rowNumber),
            number(row, CSV_COLUMN_DISK_IO, rowNumber),
            number(row, CSV_COLUMN_STORAGE, rowNumber));
        
        log.debug("Row {}: {} x{} demand {}", rowNumber, serviceName, (int) quantity, demand);
        return new ServiceDemand(serviceName, (int) quantity, demand);
    }
    
    private static double number(Map<String, String> row, String column, int rowNumber) {
        String raw = row.get(column);
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException("Row " + rowNumber + ": column '" + column 
                + "' is not a number: '" + raw + "'", e);
        }
    }
    
    private static Map<String, String> trimKeys(Map<String, String> row) {
        Map<String, String> trimmed = new HashMap<>();
        row.forEach((key, value) -> trimmed.put(key.trim(), value));
        return trimmed;
    }
}
