package io.kvchain.core.parser;

import java.util.Iterator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.events.CollectionStartEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.MappingEndEvent;
import org.yaml.snakeyaml.events.ScalarEvent;
import org.yaml.snakeyaml.events.SequenceEndEvent;

/**
 * Logs every YAML event consumed by the chain parser, indented by nesting level.
 * Enabled with <code>io.kvchain.parser.debug</code>.
 */
class TracingIterator implements Iterator<Event> {
   private static final Logger log = LogManager.getLogger(TracingIterator.class);

   private final Iterator<Event> delegate;
   private int depth;

   TracingIterator(Iterator<Event> delegate) {
      this.delegate = delegate;
   }

   @Override
   public boolean hasNext() {
      return delegate.hasNext();
   }

   @Override
   public Event next() {
      Event event = delegate.next();
      if (event instanceof MappingEndEvent || event instanceof SequenceEndEvent) {
         depth = Math.max(0, depth - 1);
      }
      log.info("{}:{} {}{}", event.getStartMark().getLine() + 1, event.getStartMark().getColumn() + 1,
            "| ".repeat(depth), event instanceof ScalarEvent ? "'" + ((ScalarEvent) event).getValue() + "'" : event.getEventId());
      if (event instanceof CollectionStartEvent) {
         depth++;
      }
      return event;
   }
}
