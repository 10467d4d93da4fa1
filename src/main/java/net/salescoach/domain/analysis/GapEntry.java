package net.salescoach.domain.analysis;

/**
 * A critical-gap list element as stored: a bare string in first-generation payloads,
 * an object in current payloads.
 */
public sealed interface GapEntry permits GapEntry.Plain, GapEntry.Structured {

    CriticalGap normalize();

    record Plain(String text) implements GapEntry {
        @Override
        public CriticalGap normalize() {
            return CriticalGap.fromPlainText(text);
        }
    }

    record Structured(CriticalGap gap) implements GapEntry {
        @Override
        public CriticalGap normalize() {
            return gap;
        }
    }
}
