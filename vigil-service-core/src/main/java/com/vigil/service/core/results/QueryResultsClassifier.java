package com.vigil.service.core.results;

/** Narrows a {@link QueryResults} by its type tag. Every {@code as*} method returns null on a mismatch. */
public final class QueryResultsClassifier {

    private QueryResultsClassifier() {}

    public static boolean isEventResults(QueryResults results) {
        return results != null && results.type() == QueryResultsType.EVENT;
    }

    public static boolean isRecordingResults(QueryResults results) {
        return results != null && results.type() == QueryResultsType.RECORDING;
    }

    public static boolean isRecordingSegmentsResults(QueryResults results) {
        return results != null && results.type() == QueryResultsType.RECORDING_SEGMENTS;
    }

    public static boolean isMediaMetadataResults(QueryResults results) {
        return results != null && results.type() == QueryResultsType.MEDIA_METADATA;
    }

    public static EventQueryResults asEventResults(QueryResults results) {
        return isEventResults(results) ? (EventQueryResults) results : null;
    }

    public static RecordingQueryResults asRecordingResults(QueryResults results) {
        return isRecordingResults(results) ? (RecordingQueryResults) results : null;
    }

    public static RecordingSegmentsQueryResults asRecordingSegmentsResults(QueryResults results) {
        return isRecordingSegmentsResults(results) ? (RecordingSegmentsQueryResults) results : null;
    }

    public static MediaMetadataQueryResults asMediaMetadataResults(QueryResults results) {
        return isMediaMetadataResults(results) ? (MediaMetadataQueryResults) results : null;
    }
}
