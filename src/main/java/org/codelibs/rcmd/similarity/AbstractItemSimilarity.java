/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.codelibs.rcmd.similarity;

import java.util.Map;

import org.codelibs.rcmd.model.InteractionMatrix;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Abstract superclass of similarities computed over the item row vectors of a
 * filled {@link InteractionMatrix}.
 */
public abstract class AbstractItemSimilarity implements ItemSimilarity {

    private final InteractionMatrix matrix;

    private final Map<Long, double[]> itemVectors;

    protected AbstractItemSimilarity(final InteractionMatrix matrix) {
        Preconditions.checkArgument(matrix != null, "matrix is null");
        Preconditions.checkArgument(matrix.isFilled(),
                "matrix must be filled before computing similarities");
        this.matrix = matrix;
        final ImmutableMap.Builder<Long, double[]> builder = ImmutableMap
                .builder();
        for (final long itemID : matrix.getItemIDs()) {
            builder.put(itemID, matrix.getItemVector(itemID));
        }
        itemVectors = builder.build();
    }

    /**
     * @param x counts of the first item, one per user
     * @param y counts of the second item, in the same user order
     * @return similarity value, or {@link Double#NaN} if none can be computed
     */
    abstract double computeResult(double[] x, double[] y);

    @Override
    public final double itemSimilarity(final long itemID1, final long itemID2) {
        final double[] x = itemVectors.get(itemID1);
        final double[] y = itemVectors.get(itemID2);
        Preconditions.checkArgument(x != null, "unknown item %s", itemID1);
        Preconditions.checkArgument(y != null, "unknown item %s", itemID2);
        if (itemID1 == itemID2) {
            return Double.NaN;
        }
        final double result = computeResult(x, y);
        return Double.isNaN(result) ? result : normalizeResult(result);
    }

    @Override
    public double[] itemSimilarities(final long itemID1, final long[] itemID2s) {
        final int length = itemID2s.length;
        final double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            result[i] = itemSimilarity(itemID1, itemID2s[i]);
        }
        return result;
    }

    static double normalizeResult(final double result) {
        // Make sure the result is not accidentally a little outside [0.0, 1.0] due to rounding:
        if (result < 0.0) {
            return 0.0;
        } else if (result > 1.0) {
            return 1.0;
        }
        return result;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "[matrix:" + matrix + ']';
    }
}
