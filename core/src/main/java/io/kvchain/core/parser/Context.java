package io.kvchain.core.parser;

import java.util.Iterator;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.MappingEndEvent;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.ScalarEvent;
import org.yaml.snakeyaml.events.SequenceEndEvent;
import org.yaml.snakeyaml.events.SequenceStartEvent;

import io.kvchain.api.config.ChainDefinitionException;

/**
 * Cursor over the YAML event stream of a chain definition with one event of lookahead.
 * Errors raised by builders while a property or a chain item is parsed are reported
 * at the position of that property or item.
 */
public class Context {
   private static final Map<Class<? extends Event>, String> EVENT_NAMES = Map.of(
         MappingStartEvent.class, "<start of mapping>",
         MappingEndEvent.class, "<end of mapping>",
         SequenceStartEvent.class, "<start of sequence>",
         SequenceEndEvent.class, "<end of sequence>",
         ScalarEvent.class, "<scalar value>");

   private final Iterator<Event> events;
   private Event lookahead;

   Context(Iterator<Event> events) {
      this.events = events;
   }

   public boolean hasNext() throws ParserException {
      return lookahead != null || pullHasNext();
   }

   public Event next() throws ParserException {
      if (lookahead != null) {
         Event event = lookahead;
         lookahead = null;
         return event;
      }
      return pull();
   }

   public Event peek() throws ParserException {
      if (lookahead == null) {
         lookahead = pull();
      }
      return lookahead;
   }

   /**
    * Drops the event returned by the last {@link #peek()}.
    */
   public void skipPeeked() {
      if (lookahead == null) {
         throw new IllegalStateException("No event was peeked");
      }
      lookahead = null;
   }

   public <E extends Event> E expectEvent(Class<E> type) throws ParserException {
      if (!hasNext()) {
         throw noMoreEvents(type);
      }
      Event event = next();
      if (!type.isInstance(event)) {
         throw new ParserException(event, "Expected " + describe(type) + ", got " + describe(event.getClass()) + ": " + event);
      }
      return type.cast(event);
   }

   @SafeVarargs
   public final ParserException noMoreEvents(Class<? extends Event>... expected) {
      return new ParserException("Definition ended while expecting one of "
            + Stream.of(expected).map(Context::describe).collect(Collectors.joining(", ", "[", "]")));
   }

   public ParserException unexpectedEvent(Event event) {
      return new ParserException(event, "Unexpected " + describe(event.getClass()) + ": " + event);
   }

   /**
    * Parses a sequence calling the parser once per item. A missing (empty) value is an empty sequence.
    */
   public <T> void parseList(T target, Parser<T> itemParser) throws ParserException {
      Event start = expectAny(SequenceStartEvent.class, ScalarEvent.class);
      if (start instanceof ScalarEvent) {
         String value = ((ScalarEvent) start).getValue();
         if (value != null && !value.isEmpty()) {
            throw new ParserException(start, "Expected a sequence, got '" + value + "'");
         }
         return;
      }
      while (hasNext()) {
         Event item = peek();
         if (item instanceof SequenceEndEvent) {
            skipPeeked();
            return;
         }
         invoke(item, itemParser, target);
      }
      throw noMoreEvents(SequenceEndEvent.class);
   }

   /**
    * Parses a mapping, picking the parser for each value by its key.
    */
   public <T> void parseMapping(T target, BuilderProvider<T> provider) throws ParserException {
      expectEvent(MappingStartEvent.class);
      while (hasNext()) {
         Event event = next();
         if (event instanceof MappingEndEvent) {
            return;
         } else if (!(event instanceof ScalarEvent)) {
            throw unexpectedEvent(event);
         }
         ScalarEvent key = (ScalarEvent) event;
         invoke(key, provider.apply(key), target);
      }
      throw noMoreEvents(MappingEndEvent.class);
   }

   private <T> void invoke(Event position, Parser<T> parser, T target) throws ParserException {
      try {
         parser.parse(this, target);
      } catch (ChainDefinitionException | IllegalArgumentException e) {
         throw new ParserException(position, e.getMessage(), e);
      }
   }

   @SafeVarargs
   private Event expectAny(Class<? extends Event>... types) throws ParserException {
      if (!hasNext()) {
         throw noMoreEvents(types);
      }
      Event event = next();
      for (Class<? extends Event> type : types) {
         if (type.isInstance(event)) {
            return event;
         }
      }
      throw unexpectedEvent(event);
   }

   private boolean pullHasNext() throws ParserException {
      try {
         return events.hasNext();
      } catch (MarkedYAMLException e) {
         throw malformed(e);
      }
   }

   private Event pull() throws ParserException {
      try {
         return events.next();
      } catch (MarkedYAMLException e) {
         throw malformed(e);
      }
   }

   private static ParserException malformed(MarkedYAMLException e) {
      Mark mark = e.getProblemMark();
      if (mark == null) {
         return new ParserException("Malformed YAML: " + e.getMessage(), e);
      }
      return new ParserException("Malformed YAML at line " + (mark.getLine() + 1) + ", column " + (mark.getColumn() + 1) + ": " + e.getProblem(), e);
   }

   private static String describe(Class<? extends Event> type) {
      return EVENT_NAMES.getOrDefault(type, type.getSimpleName());
   }

   @FunctionalInterface
   public interface BuilderProvider<T> {
      Parser<T> apply(ScalarEvent key) throws ParserException;
   }
}
