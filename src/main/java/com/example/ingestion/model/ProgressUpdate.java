package com.example.ingestion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次进度上报
 * 
 * <p>所有字段均可为空，为空表示"不修改"。
 * 由Worker在阶段切换时构造，也由管道协作方通过 {@code ProgressListener} 在每个批次完成后上报。
 * </p>
 */
public final class ProgressUpdate {

    private final ProgressStage stage;
    private final String currentFile;
    private final Integer currentFileIndex;
    private final Integer totalFiles;
    private final Integer currentBatch;
    private final Integer totalBatches;
    private final Integer currentChunk;
    private final Integer totalChunks;
    private final Integer processedFiles;
    private final Integer failedFiles;
    private final Double progressPercentage;
    private final Map<String, Object> details;

    private ProgressUpdate(Builder builder) {
        this.stage = builder.stage;
        this.currentFile = builder.currentFile;
        this.currentFileIndex = builder.currentFileIndex;
        this.totalFiles = builder.totalFiles;
        this.currentBatch = builder.currentBatch;
        this.totalBatches = builder.totalBatches;
        this.currentChunk = builder.currentChunk;
        this.totalChunks = builder.totalChunks;
        this.processedFiles = builder.processedFiles;
        this.failedFiles = builder.failedFiles;
        this.progressPercentage = builder.progressPercentage;
        this.details = builder.details == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 进入某个阶段的快捷构造
     */
    public static ProgressUpdate stage(ProgressStage stage) {
        return builder().stage(stage).build();
    }

    /**
     * 向量化批次完成的快捷构造
     */
    public static ProgressUpdate embeddingBatch(int currentBatch, int totalBatches,
                                                int chunksCompleted, int totalChunks) {
        return builder()
                .stage(ProgressStage.EMBEDDING)
                .currentBatch(currentBatch)
                .totalBatches(totalBatches)
                .currentChunk(chunksCompleted)
                .totalChunks(totalChunks)
                .build();
    }

    public ProgressStage getStage() {
        return stage;
    }

    public String getCurrentFile() {
        return currentFile;
    }

    public Integer getCurrentFileIndex() {
        return currentFileIndex;
    }

    public Integer getTotalFiles() {
        return totalFiles;
    }

    public Integer getCurrentBatch() {
        return currentBatch;
    }

    public Integer getTotalBatches() {
        return totalBatches;
    }

    public Integer getCurrentChunk() {
        return currentChunk;
    }

    public Integer getTotalChunks() {
        return totalChunks;
    }

    public Integer getProcessedFiles() {
        return processedFiles;
    }

    public Integer getFailedFiles() {
        return failedFiles;
    }

    public Double getProgressPercentage() {
        return progressPercentage;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "ProgressUpdate{stage=" + stage
                + ", file=" + currentFileIndex + "/" + totalFiles
                + ", batch=" + currentBatch + "/" + totalBatches
                + ", chunk=" + currentChunk + "/" + totalChunks
                + ", percentage=" + progressPercentage + "}";
    }

    public static final class Builder {
        private ProgressStage stage;
        private String currentFile;
        private Integer currentFileIndex;
        private Integer totalFiles;
        private Integer currentBatch;
        private Integer totalBatches;
        private Integer currentChunk;
        private Integer totalChunks;
        private Integer processedFiles;
        private Integer failedFiles;
        private Double progressPercentage;
        private Map<String, Object> details;

        private Builder() {
        }

        public Builder stage(ProgressStage stage) {
            this.stage = stage;
            return this;
        }

        public Builder currentFile(String currentFile) {
            this.currentFile = currentFile;
            return this;
        }

        public Builder currentFileIndex(Integer currentFileIndex) {
            this.currentFileIndex = currentFileIndex;
            return this;
        }

        public Builder totalFiles(Integer totalFiles) {
            this.totalFiles = totalFiles;
            return this;
        }

        public Builder currentBatch(Integer currentBatch) {
            this.currentBatch = currentBatch;
            return this;
        }

        public Builder totalBatches(Integer totalBatches) {
            this.totalBatches = totalBatches;
            return this;
        }

        public Builder currentChunk(Integer currentChunk) {
            this.currentChunk = currentChunk;
            return this;
        }

        public Builder totalChunks(Integer totalChunks) {
            this.totalChunks = totalChunks;
            return this;
        }

        public Builder processedFiles(Integer processedFiles) {
            this.processedFiles = processedFiles;
            return this;
        }

        public Builder failedFiles(Integer failedFiles) {
            this.failedFiles = failedFiles;
            return this;
        }

        public Builder progressPercentage(Double progressPercentage) {
            this.progressPercentage = progressPercentage;
            return this;
        }

        public Builder detail(String key, Object value) {
            if (this.details == null) {
                this.details = new LinkedHashMap<>();
            }
            this.details.put(key, value);
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details == null ? null : new LinkedHashMap<>(details);
            return this;
        }

        public ProgressUpdate build() {
            return new ProgressUpdate(this);
        }
    }
}
