package io.kvchain.core.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.events.DocumentEndEvent;
import org.yaml.snakeyaml.events.DocumentStartEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.StreamEndEvent;
import org.yaml.snakeyaml.events.StreamStartEvent;

import io.kvchain.internal.Properties;

/**
 * Parses YAML chain definitions:
 * <pre>
 * name: transfer
 * protocol:
 *   factory: local
 *   properties:
 *     cluster: bank
 * chain:
 * - transaction:
 *     chain:
 *     - getAndPut: { cache: accounts, key: 1, value: 100 }
 *     - commit
 * - get:
 *     cache: accounts
 *     key: 1
 *     checks:
 *     - count: 1
 * </pre>
 */
public class ChainParser extends AbstractParser<ChainDefinition, ChainDefinition> {
   private static final Logger log = LogManager.getLogger(ChainParser.class);
   private static final ChainParser INSTANCE = new ChainParser();
   private static final boolean DEBUG_PARSER = Properties.getBoolean(Properties.PARSER_DEBUG);

   public static ChainParser instance() {
      return INSTANCE;
   }

   private ChainParser() {
      register("name", PropertyParser.text(ChainDefinition::name));
      register("protocol", new ProtocolParser());
      register("chain", (ctx, target) -> ctx.parseList(target.chain(), ActionParser.instance()));
   }

   @Override
   public void parse(Context ctx, ChainDefinition target) throws ParserException {
      callSubBuilders(ctx, target);
   }

   public ChainDefinition parse(String yaml) throws ParserException {
      return parse(new StringReader(yaml));
   }

   public ChainDefinition parse(InputStream stream) throws ParserException, IOException {
      try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
         return parse(reader);
      }
   }

   private ChainDefinition parse(Reader reader) throws ParserException {
      Yaml yaml = new Yaml();
      Iterator<Event> events = yaml.parse(reader).iterator();
      if (DEBUG_PARSER) {
         events = new TracingIterator(events);
      }
      Context ctx = new Context(events);

      ctx.expectEvent(StreamStartEvent.class);
      ctx.expectEvent(DocumentStartEvent.class);

      ChainDefinition definition = new ChainDefinition();
      parse(ctx, definition);

      ctx.expectEvent(DocumentEndEvent.class);
      ctx.expectEvent(StreamEndEvent.class);
      log.debug("Parsed definition of chain {}", definition.name());
      return definition;
   }
}
