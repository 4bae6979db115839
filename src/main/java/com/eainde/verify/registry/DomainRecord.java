package com.eainde.verify.registry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted registry entry, as read from {@code verification.domains[*]} or from the JSON
 * registry file at startup.
 */
public class DomainRecord {

    private String domainId;
    private String adapterType;
    private String extractionTemplate;
    private Map<String, Object> config = new LinkedHashMap<>();
    private boolean active = true;

    public DomainRecord() {
    }

    public DomainRecord(String domainId, String adapterType, Map<String, Object> config) {
        this.domainId = domainId;
        this.adapterType = adapterType;
        this.config = config;
    }

    public String getDomainId() {
        return domainId;
    }

    public void setDomainId(String domainId) {
        this.domainId = domainId;
    }

    public String getAdapterType() {
        return adapterType;
    }

    public void setAdapterType(String adapterType) {
        this.adapterType = adapterType;
    }

    public String getExtractionTemplate() {
        return extractionTemplate;
    }

    public void setExtractionTemplate(String extractionTemplate) {
        this.extractionTemplate = extractionTemplate;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    @Override
    public String toString() {
        return "DomainRecord{domainId='" + domainId + "', adapterType='" + adapterType
                + "', active=" + active + "}";
    }
}
