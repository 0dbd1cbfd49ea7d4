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
 * An implementation of the cosine similarity. The result is the cosine of the angle formed between
 * the two item count vectors.
 * </p>
 *
 * <p>
 * Note that this similarity does not "center" its data. An item nobody interacted with has similarity
 * 0.0 to every other item.
 * </p>
 */
public final class UncenteredCosineSimilarity extends AbstractItemSimilarity {

    public UncenteredCosineSimilarity(final InteractionMatrix matrix) {
        super(matrix);
    }

    @Override
    double computeResult(final double[] x, final double[] y) {
        double sumXY = 0.0;
        double sumX2 = 0.0;
        double sumY2 = 0.0;
        for (int i = 0; i < x.length; i++) {
            sumXY += x[i] * y[i];
            sumX2 += x[i] * x[i];
            sumY2 += y[i] * y[i];
        }
        final double denominator = Math.sqrt(sumX2) * Math.sqrt(sumY2);
        return denominator != 0.0 ? sumXY / denominator : 0.0;
    }

}
