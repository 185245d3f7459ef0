package com.phillippitts.spoofstream.exception;

/**
 * Thrown when a connection declares a sample rate different from the one it committed to
 * with its first audio chunk.
 */
public class SampleRateMismatchException extends SpoofStreamException {

    private final int declaredRate;
    private final int committedRate;

    public SampleRateMismatchException(int declaredRate, int committedRate) {
        super("Sample rate mismatch: declared " + declaredRate + " Hz but connection committed to "
                + committedRate + " Hz");
        this.declaredRate = declaredRate;
        this.committedRate = committedRate;
    }

    public int getDeclaredRate() {
        return declaredRate;
    }

    public int getCommittedRate() {
        return committedRate;
    }
}
