package io.replicapacker.config;

/**
 * Application constants.
 */
public final class Constants {
    
    private Constants() {
        // Utility class
    }
    
    // Default configuration values
    public static final String DEFAULT_PACKER_ID = "replica-packer";
    public static final String DEFAULT_SEARCH_STRATEGY = "random";
    public static final int DEFAULT_SAMPLE_BUDGET = 100;
    public static final long DEFAULT_SEED = 1L;
    // Canonical order plus the full 5! permutation space
    public static final int DEFAULT_MAX_TRIALS = 121;
    public static final int DEFAULT_PARALLELISM = 1;
    public static final String DEFAULT_OUTPUT_FILE = "plan_asignacion.json";
    
    // Search strategy names
    public static final String SEARCH_STRATEGY_RANDOM = "random";
    public static final String SEARCH_STRATEGY_EXHAUSTIVE = "exhaustive";
    
    // Input CSV columns
    public static final String CSV_COLUMN_SERVICE = "Servicios";
    public static final String CSV_COLUMN_QUANTITY = "Cantidad";
    public static final String CSV_COLUMN_CPU_PERCENT = "USO CPU (%)";
    public static final String CSV_COLUMN_NETWORK = "E/S Red (Mbs)";
    public static final String CSV_COLUMN_DISK_IO = "E/S disco (MB/s)";
    public static final String CSV_COLUMN_STORAGE = "Uso Disco (GB)";
    public static final String CSV_COLUMN_MEMORY = "Memoria (GB)";
    
    // CLI options
    public static final String OPTION_CSV = "csv";
    public static final String OPTION_CORES = "cores";
    public static final String OPTION_RAM = "ram";
    public static final String OPTION_NET = "net";
    public static final String OPTION_DISK_IO = "disk-io";
    public static final String OPTION_STORAGE = "storage";
    public static final String OPTION_SEED = "seed";
    public static final String OPTION_SAMPLE_BUDGET = "sample-budget";
    public static final String OPTION_OUTPUT = "output";
}
