package tech.v2.lazyseq.storage;

import it.unimi.dsi.fastutil.objects.ObjectBigArrayBigList;


//Long indexed storage for producers with more than Integer.MAX_VALUE items.
public class BigListStorage implements ObjectStorage
{
  final ObjectBigArrayBigList data;
  public BigListStorage()
  {
    data = new ObjectBigArrayBigList();
  }
  public long lsize() { return data.size64(); }
  public Object read(long idx) { return data.get(idx); }
  public void append(Object value) { data.add(value); }
}
