/*
 * Tensor.java
 *
 * This source file is part of the ARC Conv open source project
 *
 * Copyright 2025 the ARC Conv project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.arcconv.tensor;

import com.google.common.base.Preconditions;
import org.arcconv.annotation.API;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

/**
 * A dense, row-major tensor of {@code double}s.
 * <p>
 * The shape of a tensor never changes after creation. Its elements are held in one flat array that is laid out
 * row-major, i.e. the last axis varies fastest. Feature maps use the {@code (B, C, H, W)} layout throughout this
 * library, convolution weights use {@code (Cout, Cin / groups, kH, kW)}.
 * <p>
 * {@link #reshape(int...)} returns a view sharing the underlying array, all other transformations copy. Elements can
 * be written through {@link #set(double, int...)} and {@link #getData()}; this is meant for code that fills a freshly
 * allocated tensor, tensors handed to a layer are never written to by that layer.
 */
@API(API.Status.EXPERIMENTAL)
public final class Tensor {
    @Nonnull
    private final int[] shape;
    @Nonnull
    private final int[] strides;
    @Nonnull
    private final double[] data;

    private Tensor(@Nonnull final int[] shape, @Nonnull final double[] data) {
        final int numElements = numElements(shape);
        if (numElements != data.length) {
            throw new ShapeMismatchException("data length does not match shape",
                    "shape", shapeToString(shape), "length", data.length);
        }
        this.shape = shape;
        this.strides = computeStrides(shape);
        this.data = data;
    }

    @Nonnull
    public static Tensor zeros(@Nonnull final int... shape) {
        return new Tensor(shape.clone(), new double[numElements(shape)]);
    }

    @Nonnull
    public static Tensor filled(final double value, @Nonnull final int... shape) {
        final double[] data = new double[numElements(shape)];
        Arrays.fill(data, value);
        return new Tensor(shape.clone(), data);
    }

    /**
     * Create a tensor from a copy of the given data.
     *
     * @param data the elements in row-major order
     * @param shape the shape
     * @return a new tensor
     */
    @Nonnull
    public static Tensor of(@Nonnull final double[] data, @Nonnull final int... shape) {
        return new Tensor(shape.clone(), data.clone());
    }

    /**
     * Create a tensor that uses the given array as its storage without copying it.
     *
     * @param data the elements in row-major order
     * @param shape the shape
     * @return a new tensor backed by {@code data}
     */
    @Nonnull
    public static Tensor wrap(@Nonnull final double[] data, @Nonnull final int... shape) {
        return new Tensor(shape.clone(), data);
    }

    @Nonnull
    public int[] getShape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    /**
     * Returns the size of the given axis. Negative axes count from the end, so {@code dim(-1)} is the last axis.
     * @param axis the axis
     * @return the size of that axis
     */
    public int dim(final int axis) {
        return shape[normalizeAxis(axis)];
    }

    public int numElements() {
        return data.length;
    }

    /**
     * Returns the underlying data array. This is a direct reference, not a copy.
     * @return the elements in row-major order
     */
    @Nonnull
    public double[] getData() {
        return data;
    }

    public double get(@Nonnull final int... index) {
        return data[offset(index)];
    }

    public void set(final double value, @Nonnull final int... index) {
        data[offset(index)] = value;
    }

    public int offset(@Nonnull final int... index) {
        Preconditions.checkArgument(index.length == shape.length, "index rank does not match tensor rank");
        int offset = 0;
        for (int i = 0; i < index.length; i++) {
            Preconditions.checkElementIndex(index[i], shape[i]);
            offset += index[i] * strides[i];
        }
        return offset;
    }

    /**
     * Returns a view of this tensor with a different shape but the same elements in the same order. One axis of the
     * new shape may be {@code -1}, in which case its size is inferred.
     *
     * @param newShape the new shape
     * @return a view sharing this tensor's data
     * @throws ShapeMismatchException if the number of elements differs
     */
    @Nonnull
    public Tensor reshape(@Nonnull final int... newShape) {
        final int[] resolved = newShape.clone();
        int inferred = -1;
        int known = 1;
        for (int i = 0; i < resolved.length; i++) {
            if (resolved[i] == -1) {
                Preconditions.checkArgument(inferred == -1, "only one axis can be inferred");
                inferred = i;
            } else {
                known *= resolved[i];
            }
        }
        if (inferred >= 0) {
            if (known == 0 || data.length % known != 0) {
                throw ShapeMismatchException.ofShapes("cannot infer axis of reshape", newShape, shape);
            }
            resolved[inferred] = data.length / known;
        }
        if (numElements(resolved) != data.length) {
            throw ShapeMismatchException.ofShapes("reshape must preserve the number of elements", resolved, shape);
        }
        return new Tensor(resolved, data);
    }

    /**
     * Returns a copy of this tensor with its axes reordered; axis {@code i} of the result is axis {@code axes[i]} of
     * this tensor.
     *
     * @param axes a permutation of {@code 0 .. rank() - 1}
     * @return a new, contiguous tensor
     */
    @Nonnull
    public Tensor permute(@Nonnull final int... axes) {
        Preconditions.checkArgument(axes.length == shape.length, "permutation rank does not match tensor rank");
        final boolean[] seen = new boolean[axes.length];
        final int[] newShape = new int[axes.length];
        final int[] sourceStrides = new int[axes.length];
        for (int i = 0; i < axes.length; i++) {
            Preconditions.checkArgument(axes[i] >= 0 && axes[i] < axes.length && !seen[axes[i]],
                    "not a permutation");
            seen[axes[i]] = true;
            newShape[i] = shape[axes[i]];
            sourceStrides[i] = strides[axes[i]];
        }

        final double[] result = new double[data.length];
        final int[] index = new int[axes.length];
        int sourceOffset = 0;
        for (int target = 0; target < result.length; target++) {
            result[target] = data[sourceOffset];
            // odometer increment over the new shape, tracking the source offset incrementally
            for (int axis = axes.length - 1; axis >= 0; axis--) {
                index[axis]++;
                sourceOffset += sourceStrides[axis];
                if (index[axis] < newShape[axis]) {
                    break;
                }
                sourceOffset -= sourceStrides[axis] * newShape[axis];
                index[axis] = 0;
            }
        }
        return new Tensor(newShape, result);
    }

    /**
     * Tiles this tensor {@code times} times along the given axis, i.e. the result has {@code dim(axis) * times}
     * entries along that axis and entry {@code j} of it is entry {@code j % dim(axis)} of this tensor.
     *
     * @param axis the axis to tile
     * @param times how many copies
     * @return a new tensor
     */
    @Nonnull
    public Tensor repeat(final int axis, final int times) {
        Preconditions.checkArgument(times >= 1, "times must be positive");
        final int a = normalizeAxis(axis);
        final int[] newShape = shape.clone();
        newShape[a] = shape[a] * times;
        final int outer = product(shape, 0, a);
        final int block = product(shape, a, shape.length);
        final double[] result = new double[data.length * times];
        for (int o = 0; o < outer; o++) {
            for (int t = 0; t < times; t++) {
                System.arraycopy(data, o * block, result, (o * times + t) * block, block);
            }
        }
        return new Tensor(newShape, result);
    }

    /**
     * Sums over the given axis, removing it from the shape.
     *
     * @param axis the axis to reduce
     * @return a new tensor of rank {@code rank() - 1}
     */
    @Nonnull
    public Tensor sum(final int axis) {
        final int a = normalizeAxis(axis);
        final int outer = product(shape, 0, a);
        final int size = shape[a];
        final int inner = product(shape, a + 1, shape.length);
        final double[] result = new double[outer * inner];
        for (int o = 0; o < outer; o++) {
            for (int s = 0; s < size; s++) {
                final int base = (o * size + s) * inner;
                for (int i = 0; i < inner; i++) {
                    result[o * inner + i] += data[base + i];
                }
            }
        }
        final int[] newShape = new int[shape.length - 1];
        System.arraycopy(shape, 0, newShape, 0, a);
        System.arraycopy(shape, a + 1, newShape, a, shape.length - a - 1);
        return new Tensor(newShape, result);
    }

    /**
     * Returns a copy of the sub-tensor at {@code index} along the first axis.
     *
     * @param index the index along axis 0
     * @return a new tensor of rank {@code rank() - 1}
     */
    @Nonnull
    public Tensor select(final int index) {
        Preconditions.checkElementIndex(index, shape[0]);
        final int block = strides[0];
        final double[] result = new double[block];
        System.arraycopy(data, index * block, result, 0, block);
        return new Tensor(Arrays.copyOfRange(shape, 1, shape.length), result);
    }

    @Nonnull
    public Tensor map(@Nonnull final DoubleUnaryOperator operator) {
        final double[] result = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            result[i] = operator.applyAsDouble(data[i]);
        }
        return new Tensor(shape.clone(), result);
    }

    /**
     * Element-wise sum of two tensors of the same shape.
     *
     * @param other the other tensor
     * @return a new tensor
     * @throws ShapeMismatchException if the shapes differ
     */
    @Nonnull
    public Tensor add(@Nonnull final Tensor other) {
        if (!Arrays.equals(shape, other.shape)) {
            throw ShapeMismatchException.ofShapes("tensors must have the same shape", shape, other.shape);
        }
        final double[] result = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            result[i] = data[i] + other.data[i];
        }
        return new Tensor(shape.clone(), result);
    }

    @Nonnull
    public Tensor copy() {
        return new Tensor(shape.clone(), data.clone());
    }

    public boolean hasShape(@Nonnull final int... expectedShape) {
        return Arrays.equals(shape, expectedShape);
    }

    /**
     * Returns the largest absolute element-wise difference between this tensor and another of the same shape.
     *
     * @param other the other tensor
     * @return the maximum absolute difference; {@code NaN} if any element is {@code NaN}
     */
    public double maxAbsDifference(@Nonnull final Tensor other) {
        if (!Arrays.equals(shape, other.shape)) {
            throw ShapeMismatchException.ofShapes("tensors must have the same shape", shape, other.shape);
        }
        double max = 0.0d;
        for (int i = 0; i < data.length; i++) {
            final double difference = Math.abs(data[i] - other.data[i]);
            if (Double.isNaN(difference)) {
                return Double.NaN;
            }
            max = Math.max(max, difference);
        }
        return max;
    }

    public boolean allClose(@Nonnull final Tensor other, final double tolerance) {
        return Arrays.equals(shape, other.shape) && maxAbsDifference(other) <= tolerance;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tensor)) {
            return false;
        }
        final Tensor that = (Tensor)o;
        return Arrays.equals(shape, that.shape) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
    }

    @Override
    @Nonnull
    public String toString() {
        return "Tensor[shape=" + shapeToString(shape) + "]";
    }

    @Nonnull
    public static String shapeToString(@Nonnull final int[] shape) {
        return Arrays.toString(shape);
    }

    public static int numElements(@Nonnull final int[] shape) {
        int n = 1;
        for (final int d : shape) {
            Preconditions.checkArgument(d >= 0, "negative dimension in shape");
            n *= d;
        }
        return n;
    }

    private int normalizeAxis(final int axis) {
        final int a = axis < 0 ? axis + shape.length : axis;
        Preconditions.checkElementIndex(a, shape.length, "axis");
        return a;
    }

    private static int product(@Nonnull final int[] shape, final int from, final int to) {
        int p = 1;
        for (int i = from; i < to; i++) {
            p *= shape[i];
        }
        return p;
    }

    @Nonnull
    private static int[] computeStrides(@Nonnull final int[] shape) {
        final int[] strides = new int[shape.length];
        int stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }
}
