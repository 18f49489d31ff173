package net.economicscenarios.copulas;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.random.RandomGenerator;

import net.economicscenarios.MatrixUtils;

/**
 * Base class for copulas of elliptical distributions given by a correlation matrix &rho;.
 *
 * Samples are built from correlated standard normal vectors \( x = L z \), where \( L L^{T} = \rho \) is the Cholesky
 * decomposition and z a vector of independent standard normals. Subclasses map x to uniforms.
 */
public abstract class AbstractEllipticalCopula implements CopulaInterface {

    private final double[][] correlationMatrix;
    private final double[][] choleskyFactor;

    protected AbstractEllipticalCopula(double[][] correlationMatrix) {
        super();
        if(correlationMatrix == null || correlationMatrix.length == 0) {
            throw new IllegalArgumentException("Correlation matrix must not be empty.");
        }
        if(!MatrixUtils.checkSymmetry(correlationMatrix)) {
            throw new IllegalArgumentException("Correlation matrix must be square and symmetric:\n" + MatrixUtils.printMatrix(correlationMatrix));
        }
        if(!MatrixUtils.checkUnitDiagonal(correlationMatrix)) {
            throw new IllegalArgumentException("Correlation matrix must have a unit diagonal:\n" + MatrixUtils.printMatrix(correlationMatrix));
        }

        try {
            this.choleskyFactor = new CholeskyDecomposition(new Array2DRowRealMatrix(correlationMatrix)).getL().getData();
        }
        catch(NonPositiveDefiniteMatrixException e) {
            throw new IllegalArgumentException("Correlation matrix must be positive definite:\n" + MatrixUtils.printMatrix(correlationMatrix), e);
        }

        this.correlationMatrix = new double[correlationMatrix.length][];
        for(int row = 0; row < correlationMatrix.length; row++) {
            this.correlationMatrix[row] = correlationMatrix[row].clone();
        }
    }

    @Override
    public int getDimension() {
        return correlationMatrix.length;
    }

    public double getCorrelation(int component1, int component2) {
        return correlationMatrix[component1][component2];
    }

    /**
     * Draws one vector of correlated standard normal random variables.
     *
     * @param randomGenerator The source of randomness.
     * @return The vector \( L z \).
     */
    protected double[] getCorrelatedNormals(RandomGenerator randomGenerator) {
        int dimension = getDimension();

        double[] independentNormals = new double[dimension];
        for(int i = 0; i < dimension; i++) {
            independentNormals[i] = randomGenerator.nextGaussian();
        }

        double[] correlatedNormals = new double[dimension];
        for(int row = 0; row < dimension; row++) {
            double sum = 0.0;
            for(int col = 0; col <= row; col++) {
                sum += choleskyFactor[row][col] * independentNormals[col];
            }
            correlatedNormals[row] = sum;
        }
        return correlatedNormals;
    }
}
