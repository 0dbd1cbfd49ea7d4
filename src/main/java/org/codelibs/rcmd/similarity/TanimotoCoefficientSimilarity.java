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

import org.codelibs.rcmd.model.InteractionMatrix;

/**
 * <p>
 * An implementation of a "similarity" based on the <a
 * href="http://en.wikipedia.org/wiki/Jaccard_index#Tanimoto_coefficient_.28extended_Jaccard_coefficient.29">
 * Tanimoto coefficient</a>, or extended <a href="http://en.wikipedia.org/wiki/Jaccard_index">Jaccard
 * coefficient</a>.
 * </p>
 *
 * <p>
 * This is intended for "binary" data sets where a user either expresses a generic "yes" preference for an
 * item or has no preference. Any non-zero count is a "yes", and the actual counts are ignored.
 * </p>
 *
 * <p>
 * The value returned is in [0,1]: the number of users who interacted with both items divided by the number
 * who interacted with either. Two items nobody interacted with are identical and score 1.0.
 * </p>
 */
public final class TanimotoCoefficientSimilarity extends AbstractItemSimilarity {

    public TanimotoCoefficientSimilarity(final InteractionMatrix matrix) {
        super(matrix);
    }

    @Override
    double computeResult(final double[] x, final double[] y) {
        int intersectionSize = 0;
        int unionSize = 0;
        for (int i = 0; i < x.length; i++) {
            final boolean inX = x[i] != 0.0;
            final boolean inY = y[i] != 0.0;
            if (inX && inY) {
                intersectionSize++;
            }
            if (inX || inY) {
                unionSize++;
            }
        }
        if (unionSize == 0) {
            return 1.0;
        }
        return (double) intersectionSize / (double) unionSize;
    }

}
