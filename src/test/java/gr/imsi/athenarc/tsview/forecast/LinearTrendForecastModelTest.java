package gr.imsi.athenarc.tsview.forecast;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.tsview.exception.TsApiDataException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LinearTrendForecastModelTest {

    private final LinearTrendForecastModel model = new LinearTrendForecastModel();

    @Test
    public void testExactLineIsExtended() {
        double[] values = new double[10];
        for (int i = 0; i < values.length; i++) {
            values[i] = 3 + 2 * i;
        }

        Prediction prediction = model.predict(values, 3);

        assertEquals(3, prediction.size());
        for (int step = 0; step < 3; step++) {
            double expected = 3 + 2 * (10 + step);
            assertEquals(expected, prediction.getPoint(step), 1e-9);
            assertEquals(expected, prediction.getLower(step), 1e-6);
            assertEquals(expected, prediction.getUpper(step), 1e-6);
        }
    }

    @Test
    public void testIntervalWidensWithTheHorizon() {
        double[] values = {1.0, 2.4, 2.6, 4.3, 4.8, 6.1, 6.9, 8.2, 8.8, 10.3};

        Prediction prediction = model.predict(values, 5);

        double previousWidth = 0;
        for (int step = 0; step < prediction.size(); step++) {
            assertTrue(prediction.getLower(step) < prediction.getPoint(step));
            assertTrue(prediction.getPoint(step) < prediction.getUpper(step));
            double width = prediction.getUpper(step) - prediction.getLower(step);
            assertTrue(width > previousWidth);
            previousWidth = width;
        }
    }

    @Test
    public void testMissingObservationsAreSkipped() {
        double[] values = {0, Double.NaN, 2, 3, Double.NaN, 5};
        assertEquals(6.0, model.predict(values, 1).getPoint(0), 1e-9);
    }

    @Test
    public void testTooFewObservationsAreRejected() {
        assertThrows(TsApiDataException.class, () -> model.predict(new double[]{1, Double.NaN, 2}, 2));
        assertThrows(IllegalArgumentException.class, () -> model.predict(new double[]{1, 2, 3}, 0));
    }
}
