/*
 * Copyright 2021 DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.datastax.faultline.util;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

/** A non-negative length of time written the way operators write it in YAML and in requests:
 *  <code>30s</code>, <code>5m</code>, <code>24h</code>, <code>7 days</code>.
 *
 *  <p>Serializes to and from its abbreviated string form, so it can be used directly in
 *  configuration, fault requests and persisted instances. */
public class Duration implements Comparable<Duration>
{
    private static final Duration ZERO_DURATION = new Duration(0L, TimeUnit.SECONDS);
    private static final Pattern DURATION_RE =
        Pattern.compile(
            "^(\\d+)\\s*(ns|ms|s|m|h|d|" +
                Joiner.on("|").join(TimeUnit.values()) +
                ")$",
            Pattern.CASE_INSENSITIVE);

    @JsonCreator
    public static Duration fromString(String value)
    {
        if (value == null)
            return null;

        String trimValue = value.trim();
        if (trimValue.equals("0"))
        {
            return ZERO_DURATION;
        }
        Matcher match = DURATION_RE.matcher(trimValue);
        if (!match.matches())
        {
            throw new IllegalArgumentException("Not a valid duration: '" + value + "'");
        }

        long duration = Long.parseLong(match.group(1));
        TimeUnit durationUnit;

        switch (match.group(2).toLowerCase())
        {
            case "ns":
                durationUnit = TimeUnit.NANOSECONDS;
                break;
            case "ms":
                durationUnit = TimeUnit.MILLISECONDS;
                break;
            case "s":
                durationUnit = TimeUnit.SECONDS;
                break;
            case "m":
                durationUnit = TimeUnit.MINUTES;
                break;
            case "h":
                durationUnit = TimeUnit.HOURS;
                break;
            case "d":
                durationUnit = TimeUnit.DAYS;
                break;
            default:
                durationUnit = TimeUnit.valueOf(match.group(2).toUpperCase());
                break;
        }

        return new Duration(duration, durationUnit);
    }

    /** Like {@link #fromString} but returns false instead of throwing */
    public static boolean isValid(String value)
    {
        return value != null && (value.trim().equals("0") || DURATION_RE.matcher(value.trim()).matches());
    }

    public static Duration milliseconds(long millis)
    {
        return new Duration(millis, TimeUnit.MILLISECONDS);
    }

    public static Duration seconds(long seconds)
    {
        return new Duration(seconds, TimeUnit.SECONDS);
    }

    public static Duration minutes(long value)
    {
        return new Duration(value, TimeUnit.MINUTES);
    }

    public static Duration hours(long hours)
    {
        return new Duration(hours, TimeUnit.HOURS);
    }

    public static Duration days(long days)
    {
        return new Duration(days, TimeUnit.DAYS);
    }

    public final Long value;
    public final TimeUnit unit;

    public Duration(Long value, TimeUnit unit)
    {
        Preconditions.checkNotNull(value);
        Preconditions.checkArgument(value >= 0, "Durations cannot be negative: %s", value);
        this.value = value;
        this.unit = unit;
    }

    public long toNanos()
    {
        return unit.toNanos(value);
    }

    public long toMillis()
    {
        return unit.toMillis(value);
    }

    public long toSeconds()
    {
        return unit.toSeconds(value);
    }

    public java.time.Duration toJdkDuration()
    {
        return java.time.Duration.ofNanos(toNanos());
    }

    public boolean isZero()
    {
        return value == 0L;
    }

    @Override
    public String toString()
    {
        return value + " " + unit.toString().toLowerCase();
    }

    @JsonValue
    public String toAbbrevString()
    {
        String abbrev = null;
        switch (this.unit)
        {
            case NANOSECONDS:
                abbrev = "ns";
                break;
            case MICROSECONDS:
                return TimeUnit.MICROSECONDS.toNanos(value) + "ns";
            case MILLISECONDS:
                abbrev = "ms";
                break;
            case SECONDS:
                abbrev = "s";
                break;
            case MINUTES:
                abbrev = "m";
                break;
            case HOURS:
                abbrev = "h";
                break;
            case DAYS:
                abbrev = "d";
                break;
        }
        return String.format("%s%s", this.value, abbrev);
    }

    @Override
    public int compareTo(Duration other)
    {
        return Long.compare(toNanos(), other.toNanos());
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (o == null || getClass() != o.getClass())
        {
            return false;
        }
        return ((Duration) o).toNanos() == toNanos();
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(toNanos());
    }
}
