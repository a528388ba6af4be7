package io.largecollections.storage;

/**
 * Containers whose elements live in a {@link ChunkedStorage}, enabling chunk-aligned bulk copies.
 */
interface ChunkBacked<T> {

    ChunkedStorage<T> storage();
}
