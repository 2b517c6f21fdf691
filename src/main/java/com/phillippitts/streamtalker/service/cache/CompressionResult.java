package com.phillippitts.streamtalker.service.cache;

/**
 * Outcome of a cache compression pass.
 *
 * @param filesCompressed blobs rewritten in place
 * @param bytesSaved total reduction in bytes
 */
public record CompressionResult(int filesCompressed, long bytesSaved) {
}
