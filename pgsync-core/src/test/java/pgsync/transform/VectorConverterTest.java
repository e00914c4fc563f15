package pgsync.transform;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VectorConverterTest {

  private final VectorConverter converter = new VectorConverter();

  @Test
  void nullStaysNull() {
    assertNull(converter.toFloats(null));
  }

  @Test
  void bracketedTextMatchesNumericList() {
    List<Double> expected = List.of(0.1, 0.2, 0.3);

    assertEquals(expected, converter.toFloats("[0.1,0.2,0.3]"));
    assertEquals(expected, converter.toFloats("  [ 0.1 , 0.2, 0.3 ] "));
    assertEquals(expected, converter.toFloats(List.of(0.1, 0.2, 0.3)));
    assertEquals(expected, converter.toFloats(new double[] {0.1, 0.2, 0.3}));
    assertEquals(expected, converter.toFloats(new Object[] {"0.1", 0.2, "0.3"}));
  }

  @Test
  void emptyBrackets() {
    assertEquals(List.of(), converter.toFloats("[]"));
    assertEquals(List.of(), converter.toFloats("[  ]"));
  }

  @Test
  void integerElementsBecomeDoubles() {
    assertEquals(List.of(1.0, 2.0), converter.toFloats(List.of(1, 2L)));
    assertEquals(List.of(1.0, 2.0), converter.toFloats(new int[] {1, 2}));
  }

  @Test
  void floatArrayIsWidened() {
    List<Double> out = converter.toFloats(new float[] {0.5f, 1.5f});

    assertEquals(List.of(0.5, 1.5), out);
  }

  @Test
  void rejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> converter.toFloats("0.1,0.2"));
    assertThrows(IllegalArgumentException.class, () -> converter.toFloats("[0.1, abc]"));
    assertThrows(IllegalArgumentException.class, () -> converter.toFloats(List.of(0.1, new Object())));
    assertThrows(IllegalArgumentException.class, () -> converter.toFloats(Set.of(1.0)));
    assertThrows(IllegalArgumentException.class, () -> converter.toFloats(Map.of("a", 1.0)));
    assertThrows(IllegalArgumentException.class, () -> converter.toFloats(42));
  }
}
