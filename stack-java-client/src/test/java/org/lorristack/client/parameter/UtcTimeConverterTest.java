package org.lorristack.client.parameter;

import com.beust.jcommander.ParameterException;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link UtcTimeConverter} and {@link BoundingRectConverter} classes.
 */
public class UtcTimeConverterTest {

    @Test
    public void testConvert() {
        final UtcTimeConverter converter = new UtcTimeConverter();
        Assert.assertEquals("invalid date time", Long.valueOf(1436790896L), converter.convert("2015-07-13 12:34:56"));
        Assert.assertEquals("invalid date", Long.valueOf(1436745600L), converter.convert("2015-07-13"));
    }

    @Test(expected = ParameterException.class)
    public void testInvalidTime() {
        new UtcTimeConverter().convert("13/07/2015");
    }

    @Test(expected = ParameterException.class)
    public void testInvalidRectangle() {
        new BoundingRectConverter().convert("1,2,3");
    }
}
