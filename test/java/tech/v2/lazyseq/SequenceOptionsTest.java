package tech.v2.lazyseq;

import clojure.lang.AFn;
import clojure.lang.Keyword;
import clojure.lang.RT;
import org.junit.jupiter.api.Test;
import tech.v2.lazyseq.storage.BigListStorage;
import tech.v2.lazyseq.storage.ListStorage;
import tech.v2.lazyseq.storage.Storage;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SequenceOptionsTest
{
  @Test
  void defaultsWithoutOptions()
  {
    SequenceOptions options = SequenceOptions.parse(null);
    assertSame(Storage.LIST, options.storage);
    assertEquals(Slice.IDENTITY, options.slice);
    assertSame(Storage.LIST, SequenceOptions.parse(new HashMap<>()).storage);
  }

  @Test
  void readsKeywordOptions()
  {
    Map options = (Map) RT.map(Keyword.intern("start"), 2L,
                               Keyword.intern("stop"), 8,
                               Keyword.intern("step"), 3L,
                               Keyword.intern("storage"), Keyword.intern("big-list"));
    SequenceOptions parsed = SequenceOptions.parse(options);
    assertEquals(new Slice(2L, 8L, 3), parsed.slice);
    assertSame(Storage.BIG_LIST, parsed.storage);
    assertTrue(parsed.storage.create() instanceof BigListStorage);
  }

  @Test
  void readsStringKeys()
  {
    Map<String, Object> options = new HashMap<>();
    options.put("start", -3);
    options.put(":step", BigInteger.valueOf(-1));
    options.put("stop", null);
    assertEquals(new Slice(-3L, null, -1), SequenceOptions.parse(options).slice);
  }

  @Test
  void createsSequencesFromOptions()
  {
    Map options = (Map) RT.map(Keyword.intern("start"), 10L,
                               Keyword.intern("storage"), new AFn() {
                                 public Object invoke()
                                 {
                                   return new LinkedList();
                                 }
                               });
    LazySequence s = LazySequence.create(Items.range(100), options);
    assertEquals(10L, s.read(0));
    assertEquals(90L, s.lsize());
    assertTrue(s.producer.cache() instanceof ListStorage);
  }

  @Test
  void rejectsZeroStep()
  {
    Map<String, Object> options = new HashMap<>();
    options.put("step", 0);
    assertThrows(InvalidStepException.class, () -> SequenceOptions.parse(options));
  }

  @Test
  void rejectsUnknownKeys()
  {
    Map<String, Object> options = new HashMap<>();
    options.put("stride", 2);
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> SequenceOptions.parse(options));
    assertTrue(e.getMessage().contains("stride"));
  }

  @Test
  void rejectsNonIntegerBounds()
  {
    Map<String, Object> options = new HashMap<>();
    options.put("start", 1.5);
    assertThrows(IllegalArgumentException.class, () -> SequenceOptions.parse(options));

    Map<Object, Object> badKey = new HashMap<>();
    badKey.put(7, 1);
    assertThrows(IllegalArgumentException.class, () -> SequenceOptions.parse(badKey));
  }

  @Test
  void rejectsUnusableStorage()
  {
    Map<String, Object> options = new HashMap<>();
    options.put("storage", 42);
    assertThrows(IllegalArgumentException.class, () -> SequenceOptions.parse(options));

    options.put("storage", Keyword.intern("deque"));
    assertThrows(IllegalArgumentException.class, () -> SequenceOptions.parse(options));

    options.put("storage", (java.util.function.Supplier<Object>) ArrayList::new);
    assertTrue(SequenceOptions.parse(options).storage.create() instanceof ListStorage);
  }
}
