package pardir.hir;

import java.util.List;

/**
* Implemented by the reference and member kinds that carry one index
* expression (or range) per array dimension.
*/
public interface ArrayIndexed extends Traversable {

    /**
    * Returns the index expressions in dimension order.
    */
    List<Expression> getIndices();

    /**
    * Returns the index expression of the given dimension.
    *
    * @param dim the dimension, starting at 0.
    * @throws IllegalArgumentException if the dimension is out of range.
    */
    Expression getIndex(int dim);

    /**
    * Returns the number of indexed dimensions.
    */
    int getNumIndices();

}
