/**
 * REST boundary: controllers and the mapping of exceptions to HTTP responses.
 */
package com.phillippitts.fonemas.presentation;
