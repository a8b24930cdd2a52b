package com.dealflow.dedup.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A deal-shaped record that can be compared against a pool of existing records.
 *
 * <p>The identifier is absent for records that have not been persisted yet.
 * When present it is unique within a candidate pool, and a record is never
 * compared against itself. Fields that do not take part in matching travel
 * in the opaque {@link #getAttributes() attributes} map.</p>
 */
public final class ComparableRecord {
    private final String id;
    private final String dealName;
    private final String customerName;
    private final Double dealValue;
    private final String currency;
    private final LocalDate closeDate;
    private final LocalDate registrationDate;
    private final String vendorId;
    private final String vendorName;
    private final List<String> products;
    private final List<ContactRecord> contacts;
    private final String description;
    private final String status;
    private final String sourceId;
    private final Instant createdAt;
    private final Map<String, Object> attributes;

    private ComparableRecord(Builder builder) {
        this.id = builder.id;
        this.dealName = builder.dealName;
        this.customerName = builder.customerName;
        this.dealValue = builder.dealValue;
        this.currency = builder.currency;
        this.closeDate = builder.closeDate;
        this.registrationDate = builder.registrationDate;
        this.vendorId = builder.vendorId;
        this.vendorName = builder.vendorName;
        this.products = Collections.unmodifiableList(new ArrayList<>(builder.products));
        this.contacts = Collections.unmodifiableList(new ArrayList<>(builder.contacts));
        this.description = builder.description;
        this.status = builder.status;
        this.sourceId = builder.sourceId;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public String getId() {
        return id;
    }

    public boolean hasId() {
        return id != null && !id.isEmpty();
    }

    public String getDealName() {
        return dealName;
    }

    public String getCustomerName() {
        return customerName;
    }

    public Double getDealValue() {
        return dealValue;
    }

    /**
     * Returns true when a non-zero deal value is present. A zero value is
     * treated as missing, as it is by the value similarity function.
     */
    public boolean hasDealValue() {
        return dealValue != null && dealValue != 0.0 && !dealValue.isNaN();
    }

    public String getCurrency() {
        return currency;
    }

    public LocalDate getCloseDate() {
        return closeDate;
    }

    public LocalDate getRegistrationDate() {
        return registrationDate;
    }

    public String getVendorId() {
        return vendorId;
    }

    public boolean hasVendorId() {
        return vendorId != null && !vendorId.isEmpty();
    }

    public String getVendorName() {
        return vendorName;
    }

    public List<String> getProducts() {
        return products;
    }

    public List<ContactRecord> getContacts() {
        return contacts;
    }

    public String getDescription() {
        return description;
    }

    public String getStatus() {
        return status;
    }

    /**
     * Identifier of the file or feed the record was extracted from.
     */
    public String getSourceId() {
        return sourceId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ComparableRecord that = (ComparableRecord) o;
        if (hasId() || that.hasId()) {
            return Objects.equals(id, that.id);
        }
        return Objects.equals(dealName, that.dealName)
                && Objects.equals(customerName, that.customerName)
                && Objects.equals(dealValue, that.dealValue)
                && Objects.equals(vendorId, that.vendorId);
    }

    @Override
    public int hashCode() {
        return hasId() ? Objects.hash(id) : Objects.hash(dealName, customerName, dealValue, vendorId);
    }

    @Override
    public String toString() {
        return "ComparableRecord{" +
                "id='" + id + '\'' +
                ", dealName='" + dealName + '\'' +
                ", customerName='" + customerName + '\'' +
                ", dealValue=" + dealValue +
                ", vendorId='" + vendorId + '\'' +
                ", status='" + status + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(ComparableRecord record) {
        return new Builder()
                .id(record.id)
                .dealName(record.dealName)
                .customerName(record.customerName)
                .dealValue(record.dealValue)
                .currency(record.currency)
                .closeDate(record.closeDate)
                .registrationDate(record.registrationDate)
                .vendorId(record.vendorId)
                .vendorName(record.vendorName)
                .products(record.products)
                .contacts(record.contacts)
                .description(record.description)
                .status(record.status)
                .sourceId(record.sourceId)
                .createdAt(record.createdAt)
                .attributes(record.attributes);
    }

    public static class Builder {
        private String id;
        private String dealName;
        private String customerName;
        private Double dealValue;
        private String currency;
        private LocalDate closeDate;
        private LocalDate registrationDate;
        private String vendorId;
        private String vendorName;
        private List<String> products = List.of();
        private List<ContactRecord> contacts = List.of();
        private String description;
        private String status;
        private String sourceId;
        private Instant createdAt;
        private Map<String, Object> attributes = Map.of();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder dealName(String dealName) {
            this.dealName = dealName;
            return this;
        }

        public Builder customerName(String customerName) {
            this.customerName = customerName;
            return this;
        }

        public Builder dealValue(Double dealValue) {
            this.dealValue = dealValue;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder closeDate(LocalDate closeDate) {
            this.closeDate = closeDate;
            return this;
        }

        public Builder registrationDate(LocalDate registrationDate) {
            this.registrationDate = registrationDate;
            return this;
        }

        public Builder vendorId(String vendorId) {
            this.vendorId = vendorId;
            return this;
        }

        public Builder vendorName(String vendorName) {
            this.vendorName = vendorName;
            return this;
        }

        public Builder products(List<String> products) {
            this.products = products != null ? products : List.of();
            return this;
        }

        public Builder contacts(List<ContactRecord> contacts) {
            this.contacts = contacts != null ? contacts : List.of();
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes != null ? attributes : Map.of();
            return this;
        }

        public Builder attribute(String key, Object value) {
            Map<String, Object> copy = new LinkedHashMap<>(this.attributes);
            copy.put(key, value);
            this.attributes = copy;
            return this;
        }

        public ComparableRecord build() {
            return new ComparableRecord(this);
        }
    }
}
