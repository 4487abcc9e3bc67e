package ca.gc.cra.vigil.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.Test;

class SessionTest {

  @Test
  void closesResourcesInReverseWiringOrder() throws Exception {
    List<String> closed = new ArrayList<>();
    Deque<AutoCloseable> resources = new ArrayDeque<>();
    resources.push(() -> closed.add("processor"));
    resources.push(() -> closed.add("publisher"));
    resources.push(() -> closed.add("renderer"));

    Session<String> session = new Session<>("use-case", resources);
    assertEquals("use-case", session.useCase());
    session.close();

    assertEquals(List.of("renderer", "publisher", "processor"), closed);
  }

  @Test
  void closesEverythingAndReportsFirstFailure() {
    List<String> closed = new ArrayList<>();
    IOException first = new IOException("publisher");
    IllegalStateException second = new IllegalStateException("processor");
    Deque<AutoCloseable> resources = new ArrayDeque<>();
    resources.push(() -> {
      closed.add("processor");
      throw second;
    });
    resources.push(() -> {
      closed.add("publisher");
      throw first;
    });
    resources.push(() -> closed.add("renderer"));

    Session<String> session = new Session<>("use-case", resources);
    Exception thrown = assertThrows(Exception.class, session::close);

    assertSame(first, thrown);
    assertEquals(1, thrown.getSuppressed().length);
    assertSame(second, thrown.getSuppressed()[0]);
    assertEquals(List.of("renderer", "publisher", "processor"), closed);
  }

  @Test
  void sessionCopiesResourceDeque() throws Exception {
    List<String> closed = new ArrayList<>();
    Deque<AutoCloseable> resources = new ArrayDeque<>();
    resources.push(() -> closed.add("only"));
    Session<String> session = new Session<>("use-case", resources);
    resources.clear();

    session.close();
    session.close();

    assertEquals(List.of("only"), closed);
  }
}
