package io.kvchain.core.parser;

@FunctionalInterface
public interface Parser<T> {
   void parse(Context ctx, T target) throws ParserException;
}
