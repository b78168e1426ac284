package com.jsonnetlang.targeting;

/**
 * 文本样本的空白统计
 */
public final class WhitespaceStat {
    private final int sampleSize;
    private final double whitespaceFrequency;
    private final double lineFrequency;

    private WhitespaceStat(int sampleSize, double whitespaceFrequency, double lineFrequency) {
        this.sampleSize = sampleSize;
        this.whitespaceFrequency = whitespaceFrequency;
        this.lineFrequency = lineFrequency;
    }

    /**
     * 统计空白（空格、制表符、CR、LF）占比和行频（LF 数 + 1 除以总字符数）。
     * 空样本两项频率均为 1。
     */
    public static WhitespaceStat of(String sample) {
        int lines = 1;
        int whitespace = 0;
        int other = 0;
        for (int i = 0; i < sample.length(); i++) {
            switch (sample.charAt(i)) {
                case ' ':
                case '\t':
                case '\r':
                    whitespace++;
                    break;
                case '\n':
                    whitespace++;
                    lines++;
                    break;
                default:
                    other++;
            }
        }
        int total = whitespace + other;
        if (total == 0) {
            return new WhitespaceStat(sample.length(), 1.0, 1.0);
        }
        return new WhitespaceStat(sample.length(),
                (double) whitespace / total, (double) lines / total);
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public double getWhitespaceFrequency() {
        return whitespaceFrequency;
    }

    public double getLineFrequency() {
        return lineFrequency;
    }
}
