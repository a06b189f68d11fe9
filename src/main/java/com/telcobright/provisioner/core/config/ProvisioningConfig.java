package com.telcobright.provisioner.core.config;

import com.telcobright.provisioner.core.index.FieldIndexType;
import com.telcobright.provisioner.core.index.IndexPlanner;
import com.telcobright.provisioner.core.sql.DdlStatementBuilder;

import java.time.Duration;

/**
 * Schema and indexing options for one provisioning run.
 */
public class ProvisioningConfig {
    private final boolean inTableTag;
    private final String fieldIndex;
    private final int fieldIndexCount;
    private final boolean partitionIndex;
    private final boolean timeIndex;
    private final boolean timePartitionIndex;
    private final boolean useHypertable;
    private final int numberPartitions;
    private final Duration chunkTime;
    private final boolean createDatabase;

    private ProvisioningConfig(Builder builder) {
        this.inTableTag = builder.inTableTag;
        this.fieldIndex = builder.fieldIndex;
        this.fieldIndexCount = builder.fieldIndexCount;
        this.partitionIndex = builder.partitionIndex;
        this.timeIndex = builder.timeIndex;
        this.timePartitionIndex = builder.timePartitionIndex;
        this.useHypertable = builder.useHypertable;
        this.numberPartitions = builder.numberPartitions;
        this.chunkTime = builder.chunkTime;
        this.createDatabase = builder.createDatabase;
    }

    public boolean isInTableTag() {
        return inTableTag;
    }

    public String getFieldIndex() {
        return fieldIndex;
    }

    public int getFieldIndexCount() {
        return fieldIndexCount;
    }

    public boolean isPartitionIndex() {
        return partitionIndex;
    }

    public boolean isTimeIndex() {
        return timeIndex;
    }

    public boolean isTimePartitionIndex() {
        return timePartitionIndex;
    }

    public boolean isUseHypertable() {
        return useHypertable;
    }

    public int getNumberPartitions() {
        return numberPartitions;
    }

    public Duration getChunkTime() {
        return chunkTime;
    }

    public boolean isCreateDatabase() {
        return createDatabase;
    }

    public static ProvisioningConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ProvisioningConfig{inTableTag=" + inTableTag
            + ", fieldIndex='" + fieldIndex + '\''
            + ", fieldIndexCount=" + fieldIndexCount
            + ", partitionIndex=" + partitionIndex
            + ", timeIndex=" + timeIndex
            + ", timePartitionIndex=" + timePartitionIndex
            + ", useHypertable=" + useHypertable
            + ", numberPartitions=" + numberPartitions
            + ", chunkTime=" + chunkTime
            + ", createDatabase=" + createDatabase + '}';
    }

    public static class Builder {
        private boolean inTableTag = false;
        private String fieldIndex = FieldIndexType.VALUE_MAJOR.getToken();
        private int fieldIndexCount = 0;
        private boolean partitionIndex = true;
        private boolean timeIndex = false;
        private boolean timePartitionIndex = false;
        private boolean useHypertable = true;
        private int numberPartitions = 1;
        private Duration chunkTime = Duration.ofHours(12);
        private boolean createDatabase = true;

        public Builder inTableTag(boolean inTableTag) {
            this.inTableTag = inTableTag;
            return this;
        }

        public Builder fieldIndex(String fieldIndex) {
            this.fieldIndex = fieldIndex;
            return this;
        }

        public Builder fieldIndexCount(int fieldIndexCount) {
            this.fieldIndexCount = fieldIndexCount;
            return this;
        }

        public Builder partitionIndex(boolean partitionIndex) {
            this.partitionIndex = partitionIndex;
            return this;
        }

        public Builder timeIndex(boolean timeIndex) {
            this.timeIndex = timeIndex;
            return this;
        }

        public Builder timePartitionIndex(boolean timePartitionIndex) {
            this.timePartitionIndex = timePartitionIndex;
            return this;
        }

        public Builder useHypertable(boolean useHypertable) {
            this.useHypertable = useHypertable;
            return this;
        }

        public Builder numberPartitions(int numberPartitions) {
            this.numberPartitions = numberPartitions;
            return this;
        }

        public Builder chunkTime(Duration chunkTime) {
            this.chunkTime = chunkTime;
            return this;
        }

        public Builder createDatabase(boolean createDatabase) {
            this.createDatabase = createDatabase;
            return this;
        }

        /**
         * @throws IllegalArgumentException for out-of-range numbers
         * @throws com.telcobright.provisioner.core.exception.IndexConfigurationException
         *         for an unknown field index token
         */
        public ProvisioningConfig build() {
            if (fieldIndex == null) {
                fieldIndex = "";
            }
            FieldIndexType.parseSpec(fieldIndex);
            if (fieldIndexCount < IndexPlanner.UNLIMITED) {
                throw new IllegalArgumentException(
                    "Field index count must be -1 (all) or non-negative, got " + fieldIndexCount);
            }
            if (numberPartitions <= 0 || numberPartitions > Short.MAX_VALUE) {
                throw new IllegalArgumentException(
                    "Number of partitions must be between 1 and " + Short.MAX_VALUE + ", got " + numberPartitions);
            }
            if (chunkTime == null || chunkTime.isNegative() || chunkTime.isZero()) {
                throw new IllegalArgumentException("Chunk time must be positive, got " + chunkTime);
            }
            if (DdlStatementBuilder.toMicros(chunkTime) < 1) {
                throw new IllegalArgumentException("Chunk time must be at least one microsecond, got " + chunkTime);
            }
            return new ProvisioningConfig(this);
        }
    }
}
