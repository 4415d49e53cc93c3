package com.ltlcheck.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.ltlcheck.model.PropositionId;
import com.ltlcheck.parser.ModelParser.ModelFile;
import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.Test;

public class ModelParserTest {
  private static ModelFile parse(String json) {
    return ModelParser.parse(new StringReader(json));
  }

  @Test
  public void trafficLight() throws IOException, URISyntaxException {
    ModelFile file = ModelParser.parse(Path.of(ModelParserTest.class.getResource("/traffic-light.json").toURI()));
    assertEquals("traffic light", file.name());
    assertEquals(3, file.model().states().size());

    ModelState red = file.state("red");
    assertEquals(Set.of(red), file.model().initialStates());
    assertEquals(Set.of(file.state("green")), file.model().successors(red));
    assertEquals(Set.of(PropositionId.of("isRed")), file.model().atomicPropositionsTrue(red));

    assertEquals(List.of("red then green", "eventually red", "always red"), List.copyOf(file.formulas().keySet()));
    assertEquals(Map.of("red then green", true, "eventually red", true, "always red", false), file.expected());
  }

  @Test
  public void optionalMembers() {
    ModelFile file = parse("{\"initial\": [\"a\"], \"states\": {\"a\": {}}}");
    assertEquals("model", file.name());
    ModelState a = file.state("a");
    assertTrue(a.labels().isEmpty());
    assertTrue(file.model().successors(a).isEmpty());
    assertTrue(file.formulas().isEmpty());
    assertTrue(file.expected().isEmpty());
  }

  @Test
  public void rejectsInvalidModels() {
    assertThrows(IllegalArgumentException.class,
        () -> parse("{\"initial\": [\"a\"], \"states\": {\"a\": {\"successors\": [\"b\"]}}}"));
    assertThrows(IllegalArgumentException.class,
        () -> parse("{\"initial\": [\"b\"], \"states\": {\"a\": {}}}"));
    assertThrows(IllegalArgumentException.class,
        () -> parse("{\"initial\": [], \"states\": {\"a\": {}}}"));
    assertThrows(IllegalArgumentException.class,
        () -> parse("{\"states\": {\"a\": {}}}"));
    assertThrows(IllegalArgumentException.class,
        () -> parse("{\"initial\": [\"a\"], \"states\": {\"a\": {\"labels\": \"p\"}}}"));
    assertThrows(IllegalArgumentException.class,
        () -> parse("{\"initial\": [\"a\"], \"states\": {\"a\": {}}, \"expected\": {\"f\": true}}"));
  }

  @Test
  public void rejectsNonBooleanVerdicts() {
    for (String verdict : List.of("1", "\"yes\"", "{}", "[true]", "null")) {
      String json = "{\"initial\": [\"a\"], \"states\": {\"a\": {}}, \"formulas\": {\"f\": \"p\"}, "
          + "\"expected\": {\"f\": " + verdict + "}}";
      assertThrows(verdict, IllegalArgumentException.class, () -> parse(json));
    }
  }
}
