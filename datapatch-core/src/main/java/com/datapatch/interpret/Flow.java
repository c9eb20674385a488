package com.datapatch.interpret;

import com.datapatch.value.DataValue;

/**
 * Outcome of executing a statement list: carry on with the next statement, or unwind to the
 * enclosing function call with a value.
 */
sealed interface Flow permits Flow.Continue, Flow.Return {

    Flow CONTINUE = new Continue();

    record Continue() implements Flow {
    }

    record Return(DataValue value) implements Flow {
    }
}
