package com.jsonnetlang.targeting;

import java.util.Properties;

/**
 * 目标过滤配置
 */
public class TargetingConfig {
    public static final String PREFIX = "targeting.";

    private boolean skipMinifiedFiles = true;
    private long maxTargetBytes = 0;
    private double minWhitespaceFrequency = 0.07;
    private double minLineFrequency = 0.001;
    private int sampleBlockSize = 4096;
    private int minSampleSize = 1000;

    public TargetingConfig() {
    }

    /**
     * 从 Properties 读取配置，键名带 "targeting." 前缀，缺失的键保持默认值
     */
    public static TargetingConfig fromProperties(Properties props) {
        TargetingConfig config = new TargetingConfig();
        String value = props.getProperty(PREFIX + "skipMinifiedFiles");
        if (value != null) config.setSkipMinifiedFiles(Boolean.parseBoolean(value.trim()));
        value = props.getProperty(PREFIX + "maxTargetBytes");
        if (value != null) config.setMaxTargetBytes(Long.parseLong(value.trim()));
        value = props.getProperty(PREFIX + "minWhitespaceFrequency");
        if (value != null) config.setMinWhitespaceFrequency(Double.parseDouble(value.trim()));
        value = props.getProperty(PREFIX + "minLineFrequency");
        if (value != null) config.setMinLineFrequency(Double.parseDouble(value.trim()));
        value = props.getProperty(PREFIX + "sampleBlockSize");
        if (value != null) config.setSampleBlockSize(Integer.parseInt(value.trim()));
        value = props.getProperty(PREFIX + "minSampleSize");
        if (value != null) config.setMinSampleSize(Integer.parseInt(value.trim()));
        return config;
    }

    public boolean isSkipMinifiedFiles() {
        return skipMinifiedFiles;
    }

    public void setSkipMinifiedFiles(boolean skipMinifiedFiles) {
        this.skipMinifiedFiles = skipMinifiedFiles;
    }

    /**
     * 0 表示不限制大小
     */
    public long getMaxTargetBytes() {
        return maxTargetBytes;
    }

    public void setMaxTargetBytes(long maxTargetBytes) {
        this.maxTargetBytes = maxTargetBytes;
    }

    public double getMinWhitespaceFrequency() {
        return minWhitespaceFrequency;
    }

    public void setMinWhitespaceFrequency(double minWhitespaceFrequency) {
        this.minWhitespaceFrequency = minWhitespaceFrequency;
    }

    public double getMinLineFrequency() {
        return minLineFrequency;
    }

    public void setMinLineFrequency(double minLineFrequency) {
        this.minLineFrequency = minLineFrequency;
    }

    public int getSampleBlockSize() {
        return sampleBlockSize;
    }

    public void setSampleBlockSize(int sampleBlockSize) {
        this.sampleBlockSize = sampleBlockSize;
    }

    /**
     * 样本大于该字节数才可能被判定为压缩文件
     */
    public int getMinSampleSize() {
        return minSampleSize;
    }

    public void setMinSampleSize(int minSampleSize) {
        this.minSampleSize = minSampleSize;
    }
}
