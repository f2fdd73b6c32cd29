package io.replicapacker.enums;

/**
 * The five resource dimensions every replica demand and server capacity is expressed in.
 * 
 * The declaration order is the index order of {@link io.replicapacker.models.ResourceVector}
 * and the tie-break order whenever two dimensions compare equal.
 */
public enum ResourceDimension {
    CPU("CPU"),
    MEMORY("Memory"),
    NETWORK("Network"),
    DISK_IO("DiskIO"),
    STORAGE("Storage");
    
    private final String value;
    
    ResourceDimension(String value) {
        this.value = value;
    }
    
    /**
     * Display name used in reports and error messages.
     */
    public String getValue() {
        return value;
    }
}
