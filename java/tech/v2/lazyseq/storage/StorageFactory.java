package tech.v2.lazyseq.storage;


public interface StorageFactory
{
  ObjectStorage create();
}
