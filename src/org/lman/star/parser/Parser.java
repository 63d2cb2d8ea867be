// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.lman.star.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.lman.star.ParseException;

/**
 * A parser is a pure function from a {@link Cursor} to a {@link Result}. Parsers hold no state
 * between applications, so they are built once and shared.
 *
 * Choice is ordered: {@link #or} only tries the alternative if this parser fails, and never
 * backtracks into a parser that has already succeeded.
 */
public abstract class Parser<T> {

  /**
   * Converts the value of a successful parse.
   */
  public interface Mapper<T, U> {
    U map(T value);
  }

  protected abstract Result<T> apply(Cursor cursor);

  public final Result<T> parse(Cursor cursor) {
    return apply(cursor);
  }

  /**
   * Parses the whole of |input|, throwing a {@link ParseException} at the furthest point reached
   * if it can't be.
   */
  public final T parseFully(String input) throws ParseException {
    Result<T> result = skip(eof()).parse(Cursor.start(input));
    if (!result.isSuccess())
      throw new ParseException(result.getExpected(), result.getFurthest().position());
    return result.getValue();
  }

  /**
   * Runs this parser then |next|, keeping the value of |next|.
   */
  public final <U> Parser<U> then(final Parser<U> next) {
    final Parser<T> self = this;
    return new Parser<U>() {
      @Override
      protected Result<U> apply(Cursor cursor) {
        Result<T> first = self.parse(cursor);
        if (!first.isSuccess())
          return first.asFailure();
        return next.parse(first.getNext()).aggregate(first);
      }
    };
  }

  /**
   * Runs this parser then |next|, keeping the value of this parser.
   */
  public final Parser<T> skip(final Parser<?> next) {
    final Parser<T> self = this;
    return new Parser<T>() {
      @Override
      protected Result<T> apply(Cursor cursor) {
        Result<T> first = self.parse(cursor);
        if (!first.isSuccess())
          return first;
        Result<?> second = next.parse(first.getNext()).aggregate(first);
        if (!second.isSuccess())
          return second.asFailure();
        return Result.success(first.getValue(), second.getNext()).aggregate(second);
      }
    };
  }

  /**
   * Tries this parser, and |alternative| from the same cursor only if this one fails.
   */
  public final Parser<T> or(final Parser<T> alternative) {
    final Parser<T> self = this;
    return new Parser<T>() {
      @Override
      protected Result<T> apply(Cursor cursor) {
        Result<T> first = self.parse(cursor);
        if (first.isSuccess())
          return first;
        return alternative.parse(cursor).aggregate(first);
      }
    };
  }

  public final <U> Parser<U> map(final Mapper<? super T, U> mapper) {
    final Parser<T> self = this;
    return new Parser<U>() {
      @Override
      protected Result<U> apply(Cursor cursor) {
        Result<T> result = self.parse(cursor);
        if (!result.isSuccess())
          return result.asFailure();
        return Result.success(mapper.map(result.getValue()), result.getNext()).aggregate(result);
      }
    };
  }

  /**
   * Replaces whatever this parser expected with |description| when it fails.
   */
  public final Parser<T> desc(final String description) {
    final Parser<T> self = this;
    return new Parser<T>() {
      @Override
      protected Result<T> apply(Cursor cursor) {
        Result<T> result = self.parse(cursor);
        if (result.isSuccess())
          return result;
        return Result.failure(description, cursor);
      }
    };
  }

  /**
   * Zero or more repetitions, as many as possible. Stops if a repetition consumes nothing.
   */
  public final Parser<List<T>> many() {
    final Parser<T> self = this;
    return new Parser<List<T>>() {
      @Override
      protected Result<List<T>> apply(Cursor cursor) {
        List<T> values = new ArrayList<T>();
        Result<?> last = null;
        while (true) {
          Result<T> result = self.parse(cursor).aggregate(last);
          last = result;
          if (!result.isSuccess() || result.getNext().offset == cursor.offset)
            break;
          values.add(result.getValue());
          cursor = result.getNext();
        }
        return Result.success(Collections.unmodifiableList(values), cursor).aggregate(last);
      }
    };
  }

  /**
   * Zero or more repetitions separated by |separator|. A trailing separator is not consumed.
   */
  public final Parser<List<T>> sepBy(final Parser<?> separator) {
    final Parser<T> self = this;
    return new Parser<List<T>>() {
      @Override
      protected Result<List<T>> apply(Cursor cursor) {
        List<T> values = new ArrayList<T>();
        Result<T> element = self.parse(cursor);
        if (!element.isSuccess())
          return Result.success(Collections.<T>emptyList(), cursor).aggregate(element);
        values.add(element.getValue());
        cursor = element.getNext();
        Result<?> last = element;

        while (true) {
          Result<?> sep = separator.parse(cursor).aggregate(last);
          last = sep;
          if (!sep.isSuccess())
            break;
          element = self.parse(sep.getNext()).aggregate(sep);
          last = element;
          if (!element.isSuccess())
            break;
          values.add(element.getValue());
          cursor = element.getNext();
        }
        return Result.success(Collections.unmodifiableList(values), cursor).aggregate(last);
      }
    };
  }

  /**
   * This parser, or |fallback| without consuming anything if it fails.
   */
  public final Parser<T> optional(T fallback) {
    return or(succeed(fallback));
  }

  public static <T> Parser<T> succeed(final T value) {
    return new Parser<T>() {
      @Override
      protected Result<T> apply(Cursor cursor) {
        return Result.success(value, cursor);
      }
    };
  }

  public static Parser<String> string(final String expected) {
    return new Parser<String>() {
      @Override
      protected Result<String> apply(Cursor cursor) {
        if (cursor.startsWith(expected))
          return Result.success(expected, cursor.advance(expected.length()));
        return Result.failure("'" + expected + "'", cursor);
      }
    };
  }

  /**
   * The first of |options| found at the cursor. List longer options before their prefixes.
   */
  public static Parser<String> stringFrom(String description, final String... options) {
    return new Parser<String>() {
      @Override
      protected Result<String> apply(Cursor cursor) {
        for (String option : options) {
          if (cursor.startsWith(option))
            return Result.success(option, cursor.advance(option.length()));
        }
        return Result.failure("", cursor);
      }
    }.desc(description);
  }

  /**
   * Matches |regex| anchored at the cursor. Use possessive quantifiers where the grammar shouldn't
   * backtrack.
   */
  public static Parser<String> regex(String regex, final String description) {
    final Pattern pattern = Pattern.compile(regex);
    return new Parser<String>() {
      @Override
      protected Result<String> apply(Cursor cursor) {
        Matcher matcher = pattern.matcher(cursor.input);
        matcher.region(cursor.offset, cursor.input.length());
        if (matcher.lookingAt())
          return Result.success(matcher.group(), cursor.advance(matcher.end() - cursor.offset));
        return Result.failure(description, cursor);
      }
    };
  }

  /**
   * Succeeds without consuming anything when |parser| fails at the cursor.
   */
  public static Parser<Void> notAt(final Parser<?> parser, final String description) {
    return new Parser<Void>() {
      @Override
      protected Result<Void> apply(Cursor cursor) {
        if (parser.parse(cursor).isSuccess())
          return Result.failure(description, cursor);
        return Result.success(null, cursor);
      }
    };
  }

  /**
   * Runs |parser| without consuming anything.
   */
  public static <T> Parser<T> peek(final Parser<T> parser) {
    return new Parser<T>() {
      @Override
      protected Result<T> apply(Cursor cursor) {
        Result<T> result = parser.parse(cursor);
        if (!result.isSuccess())
          return result;
        return Result.success(result.getValue(), cursor);
      }
    };
  }

  public static Parser<Void> eof() {
    return new Parser<Void>() {
      @Override
      protected Result<Void> apply(Cursor cursor) {
        if (cursor.atEnd())
          return Result.success(null, cursor);
        return Result.failure("end of input", cursor);
      }
    };
  }

  /**
   * A placeholder for a parser that is defined later, for recursive grammars.
   */
  public static final class Reference<T> extends Parser<T> {
    private Parser<T> target = null;

    public void set(Parser<T> target) {
      if (this.target != null)
        throw new IllegalStateException("Reference already set");
      this.target = target;
    }

    @Override
    protected Result<T> apply(Cursor cursor) {
      if (target == null)
        throw new IllegalStateException("Reference used before being set");
      return target.parse(cursor);
    }
  }

  /**
   * Threads a cursor through a series of parsers by hand, for rules whose parts need to be looked
   * at as they're parsed. Once a step fails the remaining steps are skipped and return null.
   */
  public static final class Sequence {
    private Cursor cursor;
    private Result<?> last = null;
    private boolean failed = false;

    public Sequence(Cursor cursor) {
      this.cursor = cursor;
    }

    public <T> T next(Parser<T> parser) {
      if (failed)
        return null;
      Result<T> result = parser.parse(cursor).aggregate(last);
      last = result;
      if (!result.isSuccess()) {
        failed = true;
        return null;
      }
      cursor = result.getNext();
      return result.getValue();
    }

    public boolean failed() {
      return failed;
    }

    public Cursor cursor() {
      return cursor;
    }

    public <T> Result<T> failure() {
      if (!failed)
        throw new IllegalStateException("Sequence has not failed");
      return last.asFailure();
    }

    public <T> Result<T> success(T value) {
      if (failed)
        throw new IllegalStateException("Sequence has failed");
      return Result.success(value, cursor).aggregate(last);
    }
  }
}
