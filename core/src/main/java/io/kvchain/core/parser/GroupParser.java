package io.kvchain.core.parser;

import io.kvchain.core.chain.ChainBuilder;

class GroupParser extends AbstractParser<ChainBuilder, GroupParser.Group> {

   GroupParser() {
      register("name", PropertyParser.text((group, name) -> group.name = name));
      register("chain", (ctx, group) -> ctx.parseList(group.body, ActionParser.instance()));
   }

   @Override
   public void parse(Context ctx, ChainBuilder target) throws ParserException {
      Group group = new Group();
      callSubBuilders(ctx, group);
      target.group(group.name, group.body);
   }

   static class Group {
      private final ChainBuilder body = ChainBuilder.chain("group");
      private String name;
   }
}
