public class Recursion {

    static int fib(int n) {
        if (n <= 1) {
            return n;
        }
        return fib(n - 1) + fib(n - 2);
    }

    static int search(int[] a, int lo, int hi, int x) {
        if (lo > hi) {
            return -1;
        }
        int mid = (lo + hi) / 2;
        if (a[mid] == x) {
            return mid;
        } else if (a[mid] < x) {
            return search(a, mid + 1, hi, x);
        } else {
            return search(a, lo, mid - 1, x);
        }
    }

    static long factorial(int n) {
        return n <= 1 ? 1 : n * factorial(n - 1);
    }
}
