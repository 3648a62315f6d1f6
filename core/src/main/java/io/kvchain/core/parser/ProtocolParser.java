package io.kvchain.core.parser;

import org.yaml.snakeyaml.events.ScalarEvent;

import io.kvchain.core.protocol.KvProtocol;

class ProtocolParser extends AbstractParser<ChainDefinition, KvProtocol.Builder> {

   ProtocolParser() {
      register("factory", PropertyParser.text(KvProtocol.Builder::factory));
      register("explicitClientStart", PropertyParser.flag(KvProtocol.Builder::explicitClientStart));
      register("properties", (ctx, builder) -> ctx.parseMapping(builder,
            event -> (ctx2, b) -> b.property(event.getValue(), ctx2.expectEvent(ScalarEvent.class).getValue())));
   }

   @Override
   public void parse(Context ctx, ChainDefinition target) throws ParserException {
      callSubBuilders(ctx, target.protocol());
   }
}
