package com.shlawgathon.faceguard.backend.index;

final class VectorMath {

    private VectorMath() {
    }

    static void requireFinite(float[] vector) {
        for (int i = 0; i < vector.length; i++) {
            if (!Float.isFinite(vector[i])) {
                throw new InvalidVectorException(i, vector[i]);
            }
        }
    }

    /**
     * Scales the vector to unit length in place.
     *
     * @return false when the vector has zero magnitude and was left untouched
     */
    static boolean normalize(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        if (sum == 0.0) {
            return false;
        }
        double norm = Math.sqrt(sum);
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] / norm);
        }
        return true;
    }

    static double dot(float[] query, float[] store, int offset, int dimension) {
        double sum = 0.0;
        for (int i = 0; i < dimension; i++) {
            sum += (double) query[i] * store[offset + i];
        }
        return sum;
    }
}
