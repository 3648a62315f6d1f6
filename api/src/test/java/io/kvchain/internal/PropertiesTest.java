package io.kvchain.internal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class PropertiesTest {
   private static final String PROPERTY = "io.kvchain.test.property";

   @AfterEach
   public void clear() {
      System.clearProperty(PROPERTY);
   }

   @Test
   public void testDefaults() {
      assertThat(Properties.get(PROPERTY, "fallback")).isEqualTo("fallback");
      assertThat(Properties.getInt(PROPERTY, 7)).isEqualTo(7);
      assertThat(Properties.getLong(PROPERTY, 7L)).isEqualTo(7L);
      assertThat(Properties.getBoolean(PROPERTY)).isFalse();
   }

   @Test
   public void testSystemProperty() {
      System.setProperty(PROPERTY, " 42 ");
      assertThat(Properties.get(PROPERTY, "fallback")).isEqualTo("42");
      assertThat(Properties.getInt(PROPERTY, 7)).isEqualTo(42);
      assertThat(Properties.getLong(PROPERTY, 7L)).isEqualTo(42L);
   }

   @Test
   public void testBlankIsUnset() {
      System.setProperty(PROPERTY, "  ");
      assertThat(Properties.getInt(PROPERTY, 3)).isEqualTo(3);
   }

   @Test
   public void testInvalidNumber() {
      System.setProperty(PROPERTY, "many");
      assertThatThrownBy(() -> Properties.getInt(PROPERTY, 3))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(PROPERTY);
   }

   @Test
   public void testBoolean() {
      System.setProperty(PROPERTY, "true");
      assertThat(Properties.getBoolean(PROPERTY)).isTrue();
   }
}
