/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.basaltdb.index;

import com.basaltdb.database.Document;
import com.basaltdb.exception.InvalidFormatException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyExpressionTest {
  private final Document document = new Document().set("_id", 1)
      .set("name", "Jay")
      .set("nothing", null)
      .set("tags", List.of("red", "green", "red", "blue"))
      .set("address", new Document().set("city", "Rome"))
      .set("phones", List.of(new Document().set("type", "home"), new Document().set("type", "work")));

  @Test
  void fieldPaths() {
    assertThat(KeyExpression.parse("$._id").execute(document, true)).containsExactly(1);
    assertThat(KeyExpression.parse("$.address.city").execute(document, true)).containsExactly("Rome");
    assertThat(KeyExpression.parse("$").execute(document, true)).containsExactly(document);
  }

  @Test
  void missingOrNullFieldYieldsANullKey() {
    assertThat(KeyExpression.parse("$.surname").execute(document, false)).containsExactly((Object) null);
    assertThat(KeyExpression.parse("$.address.zip").execute(document, false)).containsExactly((Object) null);
    assertThat(KeyExpression.parse("$.name.first").execute(document, false)).containsExactly((Object) null);
    assertThat(KeyExpression.parse("$.nothing").execute(document, false)).containsExactly((Object) null);
  }

  @Test
  void listExpressionWithoutMatchesYieldsNoKey() {
    final Document empty = new Document().set("tags", List.of());
    assertThat(KeyExpression.parse("$.tags[*]").execute(empty, false)).isEmpty();
    assertThat(KeyExpression.parse("$.tags[*]").execute(new Document(), false)).isEmpty();
    assertThat(KeyExpression.parse("$.phones[*].number").execute(document, false)).isEmpty();
  }

  @Test
  void arrayFanOut() {
    assertThat(KeyExpression.parse("$.tags[*]").execute(document, false)).containsExactly("red", "green", "red", "blue");
    assertThat(KeyExpression.parse("$.tags[*]").execute(document, true)).containsExactly("red", "green", "blue");
    assertThat(KeyExpression.parse("$.phones[*].type").execute(document, true)).containsExactly("home", "work");
    assertThat(KeyExpression.parse("$.name[*]").execute(document, true)).isEmpty();
  }

  @Test
  void invalidExpressions() {
    for (final String invalid : new String[] { "", "name", "$.", "$..a", "$[*]", "$.a[0]", "$.a b" })
      assertThatThrownBy(() -> KeyExpression.parse(invalid)).as(invalid).isInstanceOf(InvalidFormatException.class);
  }

  @Test
  void parsedExpressionsAreCached() {
    assertThat(KeyExpression.parse("$.name")).isSameAs(KeyExpression.parse("$.name"));
  }
}
