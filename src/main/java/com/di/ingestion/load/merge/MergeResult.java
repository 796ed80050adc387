package com.di.ingestion.load.merge;

/**
 * Row counts reported by the warehouse for one merge.
 *
 * @param inserted new current versions written
 * @param closed   existing rows updated (closed or overwritten)
 */
public record MergeResult(long inserted, long closed) {

    public static final MergeResult NONE = new MergeResult(0, 0);

    public MergeResult plus(MergeResult other) {
        return new MergeResult(inserted + other.inserted, closed + other.closed);
    }
}
