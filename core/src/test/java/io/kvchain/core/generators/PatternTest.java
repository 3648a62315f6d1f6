package io.kvchain.core.generators;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import io.kvchain.api.config.ChainDefinitionException;
import io.kvchain.api.session.Session;

public class PatternTest {
   private final Session session = Session.create(0, "pattern").setAttribute("foo", "FOO").setAttribute("bar", 42);

   @Test
   public void testInterpolation() {
      assertThat(new Pattern("${foo}-${bar}").apply(session)).isEqualTo("FOO-42");
      assertThat(new Pattern("key:${ bar }:end").apply(session)).isEqualTo("key:42:end");
   }

   @Test
   public void testConstant() {
      Pattern pattern = new Pattern("plain");
      assertThat(pattern.isConstant()).isTrue();
      assertThat(pattern.apply(null)).isEqualTo("plain");
      assertThat(new Pattern("").apply(null)).isEmpty();
      assertThat(new Pattern("${foo}").isConstant()).isFalse();
   }

   @Test
   public void testEscape() {
      assertThat(new Pattern("$${foo}").apply(session)).isEqualTo("${foo}");
      assertThat(new Pattern("$${foo}${foo}").apply(session)).isEqualTo("${foo}FOO");
   }

   @Test
   public void testSingleVariable() {
      assertThat(Pattern.singleVariable("${foo}")).isEqualTo("foo");
      assertThat(Pattern.singleVariable(" ${ foo } ")).isEqualTo("foo");
      assertThat(Pattern.singleVariable("${foo}${bar}")).isNull();
      assertThat(Pattern.singleVariable("x${foo}")).isNull();
   }

   @Test
   public void testMalformed() {
      assertThatThrownBy(() -> new Pattern("${foo")).isInstanceOf(ChainDefinitionException.class);
      assertThatThrownBy(() -> new Pattern("a${ }b")).isInstanceOf(ChainDefinitionException.class);
   }

   @Test
   public void testMissingVariable() {
      assertThatThrownBy(() -> new Pattern("${missing}x").apply(session))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Variable missing is not set!");
   }
}
