package net.economicscenarios;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;

public class MatrixUtils {
    public static boolean checkSymmetry(double[][] matrix) {
        for (int row = 0; row < matrix.length; row++) {
            if(matrix[row].length != matrix.length) return false;
            for (int col = 0; col < row; col++) {
                if(Math.abs(matrix[row][col] - matrix[col][row]) > 1e-14) return false;
            }
        }
        return true;
    }

    public static boolean checkUnitDiagonal(double[][] matrix) {
        for (int row = 0; row < matrix.length; row++) {
            if(Math.abs(matrix[row][row] - 1.0) > 1e-14) return false;
        }
        return true;
    }

    public static double frobeniusNorm(double[][] A, double[][] B) {
        return new Array2DRowRealMatrix(A, false).subtract(new Array2DRowRealMatrix(B, false)).getFrobeniusNorm();
    }

    public static String printMatrix(double[][] matrix) {
        StringBuilder stringBuilder = new StringBuilder();
        for (double[] row : matrix) {
            for (double value : row) {
                stringBuilder.append(value).append("\t");
            }
            stringBuilder.append("\n");
        }
        return stringBuilder.toString();
    }

    public static double[][] createIdentityMatrix(int dimension) {
        double[][] identityMatrix = new double[dimension][dimension];
        for(int i = 0; i < dimension; i++) {
            identityMatrix[i][i] = 1.0;
        }
        return identityMatrix;
    }
}
