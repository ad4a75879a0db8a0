package com.raditha.cppnorm.analyzer;

/**
 * Counters collected by {@link TokenSimplifier} for one token list.
 *
 * @param bracketPairs     linked round, square and curly pairs
 * @param templatePairs    linked angle bracket pairs
 * @param typedefsRemoved  typedef declarations inlined and deleted
 * @param usingsRemoved    using aliases inlined and deleted
 * @param aliasesSkipped   alias declarations left in place because they could not be parsed
 * @param aliasUseSites    use sites replaced by an alias expansion
 * @param variableIds      highest variable id handed out
 * @param completed        whether every phase ran
 */
public record SimplificationStats(
        int bracketPairs,
        int templatePairs,
        int typedefsRemoved,
        int usingsRemoved,
        int aliasesSkipped,
        int aliasUseSites,
        int variableIds,
        boolean completed) {

    public static SimplificationStats empty() {
        return new SimplificationStats(0, 0, 0, 0, 0, 0, 0, false);
    }
}
