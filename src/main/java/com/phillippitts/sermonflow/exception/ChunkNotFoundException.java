package com.phillippitts.sermonflow.exception;

/** A chunk had no local file at upload time, for example because it was already cleaned up. */
public class ChunkNotFoundException extends SermonFlowException {

    private final int chunkIndex;

    public ChunkNotFoundException(int chunkIndex) {
        super(ErrorKind.CHUNK_NOT_FOUND, "Audio chunk " + chunkIndex + " not found");
        this.chunkIndex = chunkIndex;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }
}
