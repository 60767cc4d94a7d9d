package tech.v2.lazyseq.storage;

import clojure.lang.RT;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;


public class ObjectListStorage implements ObjectStorage
{
  final ObjectArrayList data;
  public ObjectListStorage()
  {
    data = new ObjectArrayList();
  }
  public ObjectListStorage(int capacity)
  {
    data = new ObjectArrayList(capacity);
  }
  public long lsize() { return data.size(); }
  public Object read(long idx) { return data.get(RT.intCast(idx)); }
  public void append(Object value) { data.add(value); }
}
