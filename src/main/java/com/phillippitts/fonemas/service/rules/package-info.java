/**
 * Ordered regular-expression rewrite tables shared by the pipeline stages.
 */
package com.phillippitts.fonemas.service.rules;
