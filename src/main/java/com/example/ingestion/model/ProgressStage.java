package com.example.ingestion.model;

/**
 * 处理阶段
 * 
 * <p>每个阶段在单个文件内占据一段进度区间（百分比），
 * 整体进度再按文件序号在所有文件之间加权：
 * <ul>
 *   <li>FILE_PROCESSING：0 - 10</li>
 *   <li>TEXT_EXTRACTION：10 - 20</li>
 *   <li>EMBEDDING：20 - 90</li>
 *   <li>STORAGE：90 - 100</li>
 * </ul>
 * 声明顺序即阶段推进顺序。
 * </p>
 */
public enum ProgressStage {
    QUEUED(0.0, 0.0),

    FILE_PROCESSING(0.0, 10.0),

    TEXT_EXTRACTION(10.0, 20.0),

    EMBEDDING(20.0, 90.0),

    STORAGE(90.0, 100.0),

    COMPLETE(100.0, 100.0),

    FAILED(0.0, 0.0);

    private final double bandStart;
    private final double bandEnd;

    ProgressStage(double bandStart, double bandEnd) {
        this.bandStart = bandStart;
        this.bandEnd = bandEnd;
    }

    public double getBandStart() {
        return bandStart;
    }

    public double getBandEnd() {
        return bandEnd;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    public boolean isBefore(ProgressStage other) {
        return ordinal() < other.ordinal();
    }
}
