package net.economicscenarios;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class MatrixUtilsTest {

    @Test
    public void testSymmetryCheck() {
        assertTrue(MatrixUtils.checkSymmetry(new double[][] { { 1.0, 0.3 }, { 0.3, 1.0 } }));
        assertFalse(MatrixUtils.checkSymmetry(new double[][] { { 1.0, 0.3 }, { 0.2, 1.0 } }));
        assertFalse(MatrixUtils.checkSymmetry(new double[][] { { 1.0, 0.3, 0.1 }, { 0.3, 1.0, 0.1 } }));
    }

    @Test
    public void testIdentityHasUnitDiagonal() {
        double[][] identity = MatrixUtils.createIdentityMatrix(4);

        assertTrue(MatrixUtils.checkSymmetry(identity));
        assertTrue(MatrixUtils.checkUnitDiagonal(identity));
        assertFalse(MatrixUtils.checkUnitDiagonal(new double[][] { { 1.0, 0.0 }, { 0.0, 2.0 } }));
    }

    @Test
    public void testFrobeniusNormOfDifference() {
        double[][] a = { { 1.0, 2.0 }, { 3.0, 4.0 } };
        double[][] b = { { 1.0, 2.0 }, { 0.0, 0.0 } };

        assertEquals(5.0, MatrixUtils.frobeniusNorm(a, b), 1e-15);
        assertEquals(0.0, MatrixUtils.frobeniusNorm(a, a), 0.0);
    }
}
