package com.example.ingestion.service;

import com.example.ingestion.model.ProgressStage;

/**
 * 整体进度百分比计算
 * 
 * <p>单个文件内的进度由阶段区间决定，向量化阶段再按已完成分块数在区间内插值；
 * 整体进度 = (当前文件序号 + 文件内进度) / 文件总数。文件序号从0开始。
 * </p>
 */
public final class ProgressCalculator {

    private ProgressCalculator() {
        // 工具类，禁止实例化
    }

    public static double overallPercentage(ProgressStage stage, int currentFileIndex, int totalFiles,
                                           int currentChunk, int totalChunks) {
        if (stage == null || stage == ProgressStage.QUEUED || stage == ProgressStage.FAILED) {
            return 0.0;
        }
        if (stage == ProgressStage.COMPLETE) {
            return 100.0;
        }

        int files = Math.max(totalFiles, 1);
        int fileIndex = Math.min(Math.max(currentFileIndex, 0), files - 1);

        double stageFraction = 0.0;
        if (stage == ProgressStage.EMBEDDING && totalChunks > 0) {
            stageFraction = Math.min(Math.max((double) currentChunk / totalChunks, 0.0), 1.0);
        }
        double withinFile = stage.getBandStart() + (stage.getBandEnd() - stage.getBandStart()) * stageFraction;

        return clamp((fileIndex + withinFile / 100.0) / files * 100.0);
    }

    public static double clamp(double percentage) {
        if (Double.isNaN(percentage)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, percentage));
    }
}
