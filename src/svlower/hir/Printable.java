package svlower.hir;

import java.io.PrintWriter;

/**
* Any class implementing this interface can print its data. Every IR class
* provides a default way of printing itself as procedural source text, and
* may also allow overriding that behavior at the class level.
*/
public interface Printable {

    /**
    * Print the code for the IR represented by the object. If the object's
    * print method is null, nothing is printed.
    *
    * @param o The writer on which to print the data.
    */
    void print(PrintWriter o);

}
